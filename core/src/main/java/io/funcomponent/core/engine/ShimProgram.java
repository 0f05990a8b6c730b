package io.funcomponent.core.engine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Generated in-container program, kept as an ordered set of named text blocks until it is joined.
 *
 * <p>Immutable. {@link #text()} is deterministic: blocks are joined in {@link Block} order, runs of
 * blank lines collapse to a single blank line and the program ends with exactly one newline.
 */
public final class ShimProgram {

    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\n\n\n+");

    /** Program sections, in emission order. */
    public enum Block {
        SUPPORT_DEFINITIONS,
        EXTRA_CODE,
        FUNCTION_BODY,
        ARGUMENT_PARSER,
        INVOCATION,
        OUTPUT_SERIALIZERS,
        EPILOGUE
    }

    private final Map<Block, String> blocks;
    private final String text;

    ShimProgram(Map<Block, String> blocks) {
        Objects.requireNonNull(blocks, "blocks must not be null");
        EnumMap<Block, String> copy = new EnumMap<>(Block.class);
        for (Block block : Block.values()) {
            copy.put(block, blocks.getOrDefault(block, ""));
        }
        this.blocks = copy;
        this.text = join(copy);
    }

    /** Returns the text of a single block, empty if the block has no content. */
    public String block(Block block) {
        return blocks.get(block);
    }

    /** Returns the complete program. */
    public String text() {
        return text;
    }

    private static String join(Map<Block, String> blocks) {
        String joined = List.of(Block.values()).stream()
                .map(blocks::get)
                .collect(Collectors.joining("\n\n"));
        String collapsed = BLANK_LINE_RUNS.matcher(joined).replaceAll("\n\n");
        return stripNewlines(collapsed) + "\n";
    }

    private static String stripNewlines(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '\n') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(start, end);
    }

    @Override
    public String toString() {
        return text;
    }
}
