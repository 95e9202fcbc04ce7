package FAConvert.Minimize;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

/**
 * Immutable snapshot of a partition of state indices into blocks, keyed by block id.
 * Splitting a block yields a new snapshot with a higher version; the old snapshot stays valid,
 * so callers can iterate over one snapshot while producing the next.
 * <p>
 * Invariant: blocks are non-empty and pairwise disjoint. Block ids are never reused.
 */
public final class Partition {
    private final Int2ObjectSortedMap<IntSet> blocks;
    private final int nextId;
    private final int version;

    private Partition(Int2ObjectSortedMap<IntSet> blocks, int nextId, int version) {
        this.blocks = blocks;
        this.nextId = nextId;
        this.version = version;
    }

    /**
     * @param initialBlocks - disjoint sets of states; empty sets are omitted
     */
    public static Partition of(IntSet... initialBlocks) {
        Int2ObjectSortedMap<IntSet> blocks = new Int2ObjectRBTreeMap<>();
        int id = 0;
        for (IntSet b : initialBlocks) {
            if (!b.isEmpty()) {
                blocks.put(id++, IntSets.unmodifiable(b));
            }
        }
        return new Partition(blocks, id, 0);
    }

    /**
     * Replaces block {@code blockId} by its two parts.
     * @param blockId - block to split
     * @param intersection - first part, non-empty
     * @param remainder - second part, non-empty and disjoint from {@code intersection}
     * @return the new snapshot and the ids of both parts
     */
    public Split split(int blockId, IntSet intersection, IntSet remainder) {
        IntSet old = blocks.get(blockId);
        if (old == null) {
            throw new IllegalArgumentException("No block with id " + blockId + " in partition version " + version);
        }
        if (intersection.isEmpty() || remainder.isEmpty()
            || intersection.size() + remainder.size() != old.size()) {
            throw new IllegalArgumentException("Split of block " + blockId + " is not a proper bipartition");
        }
        Int2ObjectSortedMap<IntSet> next = new Int2ObjectRBTreeMap<>(blocks);
        next.remove(blockId);
        next.put(nextId, IntSets.unmodifiable(intersection));
        next.put(nextId + 1, IntSets.unmodifiable(remainder));
        return new Split(new Partition(next, nextId + 2, version + 1), nextId, nextId + 1);
    }

    public boolean contains(int blockId) {
        return blocks.containsKey(blockId);
    }

    public IntSet getBlock(int blockId) {
        return blocks.get(blockId);
    }

    /**
     * @return block ids in increasing order
     */
    public IntList blockIds() {
        return new IntArrayList(blocks.keySet());
    }

    public int size() {
        return blocks.size();
    }

    public int getVersion() {
        return version;
    }

    /**
     * @param numStates - states are 0 .. numStates-1
     * @return block id of each state, -1 for states not covered
     */
    public int[] blockOfStates(int numStates) {
        int[] result = new int[numStates];
        Arrays.fill(result, -1);
        for (Int2ObjectMap.Entry<IntSet> e : blocks.int2ObjectEntrySet()) {
            for (int q : e.getValue()) {
                result[q] = e.getIntKey();
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Partition{version=" + version + ", blocks=" + blocks + "}";
    }

    public record Split(Partition partition, int intersectionId, int remainderId) { }
}
