package io.funcomponent.core.model;

/**
 * How a parameter's data crosses the container process boundary.
 *
 * <ul>
 *   <li>{@link #BY_VALUE}: the argument value is passed inline on the command line.
 *   <li>{@link #INPUT_PATH}, {@link #OUTPUT_PATH}: the function receives a local file path.
 *   <li>{@code *_STREAM}: the function receives an already opened file object.
 *   <li>{@link #BY_RETURN_VALUE}: output produced by the function's return value.
 * </ul>
 *
 * <p>Resolved once during signature analysis; downstream components switch on this enum instead
 * of re-inspecting annotations.
 */
public enum PassingStyle {
    BY_VALUE(Direction.INPUT, null, null),
    INPUT_PATH(Direction.INPUT, "InputPath", null),
    INPUT_TEXT_STREAM(Direction.INPUT, "InputTextFile", "rt"),
    INPUT_BINARY_STREAM(Direction.INPUT, "InputBinaryFile", "rb"),
    OUTPUT_PATH(Direction.OUTPUT, "OutputPath", null),
    OUTPUT_TEXT_STREAM(Direction.OUTPUT, "OutputTextFile", "wt"),
    OUTPUT_BINARY_STREAM(Direction.OUTPUT, "OutputBinaryFile", "wb"),
    BY_RETURN_VALUE(Direction.OUTPUT, null, null);

    /** Data flow direction of a passing style. */
    public enum Direction {
        INPUT,
        OUTPUT
    }

    private final Direction direction;
    private final String markerName;
    private final String fileMode;

    PassingStyle(Direction direction, String markerName, String fileMode) {
        this.direction = direction;
        this.markerName = markerName;
        this.fileMode = fileMode;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isOutput() {
        return direction == Direction.OUTPUT;
    }

    /** {@code true} for the six file or stream styles that are selected by an annotation marker. */
    public boolean isFileStyle() {
        return markerName != null;
    }

    /** {@code true} for {@link #INPUT_PATH} and {@link #OUTPUT_PATH}. */
    public boolean isPath() {
        return this == INPUT_PATH || this == OUTPUT_PATH;
    }

    /** {@code true} for the four open-stream styles. */
    public boolean isStream() {
        return fileMode != null;
    }

    /**
     * Name of the annotation marker class used in function signatures, e.g. {@code InputPath}.
     *
     * @return the marker class name, or {@code null} for {@link #BY_VALUE} and
     *     {@link #BY_RETURN_VALUE}
     */
    public String markerName() {
        return markerName;
    }

    /** Python {@code open()} mode for stream styles ({@code "rt"}, {@code "wb"}, ...), else null. */
    public String fileMode() {
        return fileMode;
    }
}
