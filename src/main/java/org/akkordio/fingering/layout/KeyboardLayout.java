package org.akkordio.fingering.layout;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.akkordio.fingering.model.ButtonPosition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable treble keyboard layout: pitch-to-button index plus physical spacing constants.
 *
 * <p>Acts as the geometry oracle for the search. Lookups are read-only, so a single
 * instance can be shared by concurrent solves.</p>
 */
@Getter
@Accessors(fluent = true)
public final class KeyboardLayout {
    public static final double DEFAULT_ROW_SPACING_MM = 15.0d;
    public static final double DEFAULT_COLUMN_SPACING_MM = 18.0d;
    public static final double DEFAULT_MAX_HAND_SPAN_MM = 110.0d;

    private static final Comparator<ButtonPosition> BUTTON_ORDER =
            Comparator.comparingInt(ButtonPosition::row).thenComparingInt(ButtonPosition::column);

    private final String layoutId;
    private final int rows;
    private final int columns;
    private final double rowSpacingMm;
    private final double columnSpacingMm;
    private final double maxHandSpanMm;
    @Getter(AccessLevel.NONE)
    private final Int2ObjectOpenHashMap<List<ButtonPosition>> positionsByPitch;
    @Getter(AccessLevel.NONE)
    private final Map<ButtonPosition, Integer> pitchByButton;

    private KeyboardLayout(Builder builder) {
        this.layoutId = requireText(builder.layoutId);
        this.rowSpacingMm = requirePositive(builder.rowSpacingMm, "rowSpacingMm");
        this.columnSpacingMm = requirePositive(builder.columnSpacingMm, "columnSpacingMm");
        this.maxHandSpanMm = requirePositive(builder.maxHandSpanMm, "maxHandSpanMm");
        if (builder.buttons.isEmpty()) {
            throw new IllegalArgumentException("layout " + layoutId + " has no buttons");
        }

        int maxRow = 0;
        int maxColumn = 0;
        Int2ObjectOpenHashMap<List<ButtonPosition>> index = new Int2ObjectOpenHashMap<>();
        for (Map.Entry<ButtonPosition, Integer> entry : builder.buttons.entrySet()) {
            ButtonPosition position = entry.getKey();
            maxRow = Math.max(maxRow, position.row());
            maxColumn = Math.max(maxColumn, position.column());
            List<ButtonPosition> positions = index.get(entry.getValue().intValue());
            if (positions == null) {
                positions = new ArrayList<>();
                index.put(entry.getValue().intValue(), positions);
            }
            positions.add(position);
        }
        for (int midi : index.keySet().toIntArray()) {
            List<ButtonPosition> sorted = new ArrayList<>(index.get(midi));
            sorted.sort(BUTTON_ORDER);
            index.put(midi, List.copyOf(sorted));
        }
        index.trim();

        this.positionsByPitch = index;
        this.pitchByButton = Map.copyOf(builder.buttons);
        this.rows = maxRow + 1;
        this.columns = maxColumn + 1;
    }

    /**
     * Returns candidate buttons producing {@code midi}, ordered by row then column.
     *
     * @throws UnmappablePitchException when the pitch is outside the instrument range.
     */
    public List<ButtonPosition> candidates(int midi) {
        List<ButtonPosition> positions = positionsByPitch.get(midi);
        if (positions == null) {
            throw new UnmappablePitchException(midi, layoutId);
        }
        return positions;
    }

    /**
     * Returns whether the layout has at least one button for {@code midi}.
     */
    public boolean isMappable(int midi) {
        return positionsByPitch.containsKey(midi);
    }

    /**
     * Returns the pitch of a button, or {@code -1} when the coordinate is not on the layout.
     */
    public int pitchAt(ButtonPosition position) {
        Integer midi = pitchByButton.get(Objects.requireNonNull(position, "position"));
        return midi == null ? -1 : midi;
    }

    /**
     * Returns every mapped pitch in ascending order.
     */
    public IntSortedSet pitches() {
        return new IntAVLTreeSet(positionsByPitch.keySet());
    }

    public int buttonCount() {
        return pitchByButton.size();
    }

    /**
     * Physical middle of the keyboard, used as the neutral resting row.
     */
    public double middleRow() {
        return (rows - 1) * 0.5d;
    }

    /**
     * Physical middle of the keyboard, used as the neutral resting column.
     */
    public double middleColumn() {
        return (columns - 1) * 0.5d;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String requireText(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("layoutId must be non-blank");
        }
        return value;
    }

    private static double requirePositive(double value, String field) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(field + " must be finite and > 0, got " + value);
        }
        return value;
    }

    /**
     * Mutable layout builder. Buttons keep insertion order until build.
     */
    public static final class Builder {
        private String layoutId = "custom";
        private double rowSpacingMm = DEFAULT_ROW_SPACING_MM;
        private double columnSpacingMm = DEFAULT_COLUMN_SPACING_MM;
        private double maxHandSpanMm = DEFAULT_MAX_HAND_SPAN_MM;
        private final LinkedHashMap<ButtonPosition, Integer> buttons = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder layoutId(String layoutId) {
            this.layoutId = layoutId;
            return this;
        }

        public Builder rowSpacingMm(double rowSpacingMm) {
            this.rowSpacingMm = rowSpacingMm;
            return this;
        }

        public Builder columnSpacingMm(double columnSpacingMm) {
            this.columnSpacingMm = columnSpacingMm;
            return this;
        }

        public Builder maxHandSpanMm(double maxHandSpanMm) {
            this.maxHandSpanMm = maxHandSpanMm;
            return this;
        }

        /**
         * Adds one button. A coordinate may appear only once.
         */
        public Builder button(int row, int column, int midi) {
            if (midi < 0 || midi > 127) {
                throw new IllegalArgumentException("midi must be in [0, 127], got " + midi);
            }
            ButtonPosition position = new ButtonPosition(row, column);
            if (buttons.putIfAbsent(position, midi) != null) {
                throw new IllegalArgumentException("duplicate button coordinate " + position);
            }
            return this;
        }

        public KeyboardLayout build() {
            return new KeyboardLayout(this);
        }
    }
}
