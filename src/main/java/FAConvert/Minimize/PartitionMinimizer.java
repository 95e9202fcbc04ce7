package FAConvert.Minimize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import FAConvert.AutomatonTrim;
import FAConvert.Model.DeterministicAutomaton;
import FAConvert.Model.PreconditionException;
import FAConvert.Model.SchemaException;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hopcroft-style partition refinement for DFAs.
 * <p>
 * States are numbered by their position in the (sorted) state list. Only the given states are refined:
 * an undefined transition lies in no preimage and stays undefined in the result, and every state, dead or not,
 * is mapped to a block.
 * Result states are named {@code S0, S1, ...}: the block of the initial state first, then by smallest member name.
 */
public class PartitionMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionMinimizer.class);

    public static final String BLOCK_PREFIX = "S";

    private final boolean trimUnreachable;

    public PartitionMinimizer() {
        this(false);
    }

    /**
     * @param trimUnreachable - if true, states unreachable from the initial state are discarded before refinement
     */
    public PartitionMinimizer(boolean trimUnreachable) {
        this.trimUnreachable = trimUnreachable;
    }

    public static DeterministicAutomaton minimizeDFA(DeterministicAutomaton dfa) {
        return new PartitionMinimizer().minimize(dfa);
    }

    /**
     * @param dfa - deterministic automaton, possibly partial
     * @return minimal equivalent DFA
     * @throws PreconditionException if {@code dfa} has no states or its initial state is not one of them
     * @throws SchemaException if a transition refers to an undeclared state or symbol
     */
    public DeterministicAutomaton minimize(DeterministicAutomaton dfa) {
        checkPreconditions(dfa);
        if (trimUnreachable) {
            int before = dfa.size();
            dfa = AutomatonTrim.trim(dfa);
            if (dfa.size() < before) {
                LOG.debug("Trimmed unreachable states: {} -> {}", before, dfa.size());
            }
        }

        final List<String> names = dfa.getStates();
        final List<String> alphabet = dfa.getAlphabet();
        final int numStates = names.size();
        final int numInputs = alphabet.size();

        Object2IntMap<String> index = new Object2IntOpenHashMap<>(numStates);
        index.defaultReturnValue(-1);
        for (int q = 0; q < numStates; q++) {
            index.put(names.get(q), q);
        }

        // succ[a][q]; -1 where the transition is undefined
        int[][] succ = new int[numInputs][numStates];
        for (int a = 0; a < numInputs; a++) {
            for (int q = 0; q < numStates; q++) {
                String t = dfa.getSuccessor(names.get(q), alphabet.get(a));
                succ[a][q] = t == null ? -1 : index.getInt(t);
            }
        }

        Partition partition = refine(initialPartition(dfa, names), succ, numInputs, numStates);
        LOG.debug("Partition refinement: {} states -> {} blocks after {} splits",
            numStates, partition.size(), partition.getVersion());

        return extract(dfa, names, index, succ, partition, numStates);
    }

    private static void checkPreconditions(DeterministicAutomaton dfa) {
        if (dfa.getStates().isEmpty()) {
            throw new PreconditionException("DFA has no states");
        }
        if (dfa.getInitialState() == null || !dfa.getStates().contains(dfa.getInitialState())) {
            throw new PreconditionException("Initial state '" + dfa.getInitialState() + "' is not in the state list");
        }
        TreeSet<String> states = new TreeSet<>(dfa.getStates());
        TreeSet<String> symbols = new TreeSet<>(dfa.getAlphabet());
        for (String f : dfa.getFinalStates()) {
            if (!states.contains(f)) {
                throw new SchemaException("Final state is not in the state list: " + f);
            }
        }
        for (Map.Entry<String, SortedMap<String, String>> row : dfa.getTransitions().entrySet()) {
            if (!states.contains(row.getKey())) {
                throw new SchemaException("Transition origin is not in the state list: " + row.getKey());
            }
            for (Map.Entry<String, String> e : row.getValue().entrySet()) {
                if (!symbols.contains(e.getKey())) {
                    throw new SchemaException("Transition symbol is not in the alphabet: " + e.getKey());
                }
                if (!states.contains(e.getValue())) {
                    throw new SchemaException("Transition destination is not in the state list: " + e.getValue());
                }
            }
        }
    }

    private static Partition initialPartition(DeterministicAutomaton dfa, List<String> names) {
        IntSet finals = new IntOpenHashSet();
        IntSet nonFinals = new IntOpenHashSet();
        for (int q = 0; q < names.size(); q++) {
            if (dfa.isFinal(names.get(q))) {
                finals.add(q);
            } else {
                nonFinals.add(q);
            }
        }
        return Partition.of(finals, nonFinals);
    }

    /**
     * Worklist refinement. The worklist holds block ids; ids of blocks that were split since they were queued
     * are dropped from {@code pending} and skipped when dequeued.
     */
    static Partition refine(Partition partition, int[][] succ, int numInputs, int numStates) {
        // pred[a][t] = states q with succ[a][q] == t; undefined transitions are in no preimage
        IntArrayList[][] pred = new IntArrayList[numInputs][numStates];
        for (int a = 0; a < numInputs; a++) {
            for (int q = 0; q < numStates; q++) {
                int t = succ[a][q];
                if (t < 0) {
                    continue;
                }
                if (pred[a][t] == null) {
                    pred[a][t] = new IntArrayList();
                }
                pred[a][t].add(q);
            }
        }

        IntArrayFIFOQueue worklist = new IntArrayFIFOQueue();
        IntSet pending = new IntOpenHashSet();
        for (int id : partition.blockIds()) {
            worklist.enqueue(id);
            pending.add(id);
        }

        while (!worklist.isEmpty()) {
            int splitterId = worklist.dequeueInt();
            if (!pending.remove(splitterId)) {
                continue; // split after it was queued; its parts are queued instead
            }
            IntSet splitter = partition.getBlock(splitterId);

            for (int a = 0; a < numInputs; a++) {
                IntSet preimage = new IntOpenHashSet();
                for (int t : splitter) {
                    if (pred[a][t] != null) {
                        preimage.addAll(pred[a][t]);
                    }
                }
                if (preimage.isEmpty()) {
                    continue;
                }

                Partition snapshot = partition;
                for (int blockId : snapshot.blockIds()) {
                    IntSet block = snapshot.getBlock(blockId);
                    IntSet inter = new IntOpenHashSet();
                    IntSet rest = new IntOpenHashSet();
                    for (int q : block) {
                        if (preimage.contains(q)) {
                            inter.add(q);
                        } else {
                            rest.add(q);
                        }
                    }
                    if (inter.isEmpty() || rest.isEmpty()) {
                        continue;
                    }

                    Partition.Split split = partition.split(blockId, inter, rest);
                    partition = split.partition();
                    if (pending.remove(blockId)) {
                        worklist.enqueue(split.intersectionId());
                        worklist.enqueue(split.remainderId());
                        pending.add(split.intersectionId());
                        pending.add(split.remainderId());
                    } else {
                        int smaller = inter.size() <= rest.size() ? split.intersectionId() : split.remainderId();
                        worklist.enqueue(smaller);
                        pending.add(smaller);
                    }
                }
            }
        }
        return partition;
    }

    private static DeterministicAutomaton extract(DeterministicAutomaton dfa, List<String> names,
                                                  Object2IntMap<String> index, int[][] succ,
                                                  Partition partition, int numStates) {
        final List<String> alphabet = dfa.getAlphabet();
        final int initial = index.getInt(dfa.getInitialState());

        List<int[]> blocks = new ArrayList<>();
        for (int id : partition.blockIds()) {
            blocks.add(partition.getBlock(id).intStream().sorted().toArray());
        }
        // names are sorted, so the smallest index is the smallest member name
        blocks.sort(Comparator.<int[], Boolean>comparing(b -> !contains(b, initial)).thenComparingInt(b -> b[0]));

        int[] blockOf = new int[numStates];
        for (int i = 0; i < blocks.size(); i++) {
            for (int q : blocks.get(i)) {
                blockOf[q] = i;
            }
        }

        TreeSet<String> finals = new TreeSet<>();
        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            int[] members = blocks.get(i);
            String blockName = BLOCK_PREFIX + i;
            for (int q : members) {
                if (dfa.isFinal(names.get(q))) {
                    finals.add(blockName);
                    break;
                }
            }
            int rep = members[0];
            SortedMap<String, String> row = new TreeMap<>();
            for (int a = 0; a < alphabet.size(); a++) {
                int t = succ[a][rep];
                if (t >= 0) {
                    row.put(alphabet.get(a), BLOCK_PREFIX + blockOf[t]);
                }
            }
            table.put(blockName, row);
        }

        return new DeterministicAutomaton(alphabet, table.keySet(), BLOCK_PREFIX + blockOf[initial], finals, table);
    }

    private static boolean contains(int[] sorted, int q) {
        return Arrays.binarySearch(sorted, q) >= 0;
    }
}
