package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.bytes.Byte2IntMap;
import it.unimi.dsi.fastutil.bytes.Byte2IntMaps;
import it.unimi.dsi.fastutil.bytes.Byte2IntOpenHashMap;

import javax.annotation.concurrent.NotThreadSafe;

import static software.amazon.ahocorasick.Constants.BYTE_MASK;
import static software.amazon.ahocorasick.Constants.NIL_STATE;

/**
 * A construction-time state of the pattern trie. States live in the builder's arena and refer to each other only by
 * id: forward transitions are owned edges, while the parent, failure and dictionary links are plain indexes.
 */
@NotThreadSafe
class TrieState {

    private final int id;

    // the edge label from the parent, meaningless for the root and the nil state
    private final byte value;

    // kept for diagnostics, never traversed
    private final int parent;

    private final Byte2IntOpenHashMap children = new Byte2IntOpenHashMap(0);

    /* Zero unless a pattern ends here, in which case it is that pattern's length. Since a pattern ending here spells
     * out the path from the root, this is also the depth of the state.
     */
    private int dictLength = 0;

    // only meaningful when dictLength > 0
    private int patternIndex = 0;

    private int failureLink = NIL_STATE;
    private int dictionaryLink = NIL_STATE;

    TrieState(int id, byte value, int parent) {
        this.id = id;
        this.value = value;
        this.parent = parent;
        children.defaultReturnValue(NIL_STATE);
    }

    int getId() {
        return id;
    }

    byte getValue() {
        return value;
    }

    int getParent() {
        return parent;
    }

    /**
     * Returns the id of the child reached on the given byte, or {@link Constants#NIL_STATE} if there is none.
     *
     * @param b the edge label
     * @return the child id or {@code NIL_STATE}
     */
    int getChild(byte b) {
        return children.get(b);
    }

    void putChild(byte b, int child) {
        children.put(b, child);
    }

    boolean hasChildren() {
        return !children.isEmpty();
    }

    Iterable<Byte2IntMap.Entry> children() {
        return Byte2IntMaps.fastIterable(children);
    }

    boolean isAccepting() {
        return dictLength > 0;
    }

    int getDictLength() {
        return dictLength;
    }

    int getPatternIndex() {
        return patternIndex;
    }

    void accept(int length, int patternIndex) {
        this.dictLength = length;
        this.patternIndex = patternIndex;
    }

    int getFailureLink() {
        return failureLink;
    }

    void setFailureLink(int failureLink) {
        this.failureLink = failureLink;
    }

    int getDictionaryLink() {
        return dictionaryLink;
    }

    void setDictionaryLink(int dictionaryLink) {
        this.dictionaryLink = dictionaryLink;
    }

    @Override
    public String toString() {
        return "TS: id=" + id + " parent=" + parent + " value=" + (value & BYTE_MASK) + " children=" + children.size() +
                " dict=" + dictLength + (dictLength > 0 ? " pattern=" + patternIndex : "") +
                " fail=" + failureLink + " dictLink=" + dictionaryLink;
    }
}
