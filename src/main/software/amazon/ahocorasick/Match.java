package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * One occurrence of a pattern in a scanned input. Holds a reference to the input, not a copy, so the input must not
 * be modified while the match is in use.
 */
@Immutable
public final class Match {

    private final byte[] input;
    private final int start;
    private final int length;
    private final int patternIndex;

    Match(final byte[] input, final int start, final int length, final int patternIndex) {
        this.input = input;
        this.start = start;
        this.length = length;
        this.patternIndex = patternIndex;
    }

    static Match ofEnd(final byte[] input, final int end, final int length, final int patternIndex) {
        return new Match(input, end - length + 1, length, patternIndex);
    }

    /**
     * @return index of the first matched byte
     */
    public int getStart() {
        return start;
    }

    /**
     * @return index of the last matched byte
     */
    public int getEnd() {
        return start + length - 1;
    }

    public int getLength() {
        return length;
    }

    public int getPatternIndex() {
        return patternIndex;
    }

    /**
     * Returns a read-only view of the matched range of the original input. Position 0 of the buffer is the first
     * matched byte.
     *
     * @return a view of the matched bytes
     */
    public ByteBuffer getMatchedBytes() {
        return ByteBuffer.wrap(input, start, length).slice().asReadOnlyBuffer();
    }

    public byte[] copyMatchedBytes() {
        return Arrays.copyOfRange(input, start, start + length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match other = (Match) o;
        return start == other.start && length == other.length && patternIndex == other.patternIndex;
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + length;
        result = 31 * result + patternIndex;
        return result;
    }

    @Override
    public String toString() {
        return "Match{start=" + start + ", length=" + length + ", patternIndex=" + patternIndex + '}';
    }
}
