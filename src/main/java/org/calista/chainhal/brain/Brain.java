package org.calista.chainhal.brain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.chainhal.text.Sentence;
import org.calista.chainhal.text.Word;
import org.calista.chainhal.text.WordSet;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Brain — the chain index.
 *
 * <p>
 * Holds every learned {@link Chain}, the chains each word occurs in, the words seen right
 * before/after each chain, and the chains that started/ended a learned sentence.
 * The index is append-only: chains are never removed and the adjacency sets only grow.
 * </p>
 *
 * <h3>Concurrency</h3>
 * One read/write lock guards the whole index. {@link #addSentence} holds the write lock for
 * one sentence; generation runs inside {@link #read} and holds the read lock for the whole walk.
 *
 * <h3>Consistency</h3>
 * A chain that is not a start chain always has at least one word before it, and a chain that
 * is not an end chain always has one after it. Learning maintains this by construction; the
 * random walk depends on it to terminate.
 */
public final class Brain {

    private static final Logger log = LogManager.getLogger(Brain.class);

    private final ChainSet chains = new ChainSet();
    private final Map<Word, ChainSet> wordChains = new HashMap<>();
    private final Map<Chain, WordSet> wordsBefore = new HashMap<>();
    private final Map<Chain, WordSet> wordsAfter = new HashMap<>();
    private final ChainSet startChains = new ChainSet();
    private final ChainSet endChains = new ChainSet();

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final View view = new View();

    // =========================
    // Learning
    // =========================

    /**
     * Indexes every window of {@link Chain#LENGTH} consecutive words of the sentence.
     * Sentences shorter than one chain are ignored.
     */
    public void addSentence(Sentence s) {
        Objects.requireNonNull(s, "s");
        if (s.size() < Chain.LENGTH) return;

        List<Word> ws = s.asList();
        int windows = ws.size() - (Chain.LENGTH - 1);

        rw.writeLock().lock();
        try {
            for (int i = 0; i < windows; i++) {
                Chain c = Chain.of(ws.subList(i, i + Chain.LENGTH));
                chains.add(c);

                for (int k = 0; k < Chain.LENGTH; k++) {
                    wordChains.computeIfAbsent(c.get(k), w -> new ChainSet()).add(c);
                }

                if (i == 0) {
                    startChains.add(c);
                } else {
                    wordsBefore.computeIfAbsent(c, x -> new WordSet()).add(ws.get(i - 1));
                }

                if (i == windows - 1) {
                    endChains.add(c);
                } else {
                    wordsAfter.computeIfAbsent(c, x -> new WordSet()).add(ws.get(i + Chain.LENGTH));
                }
            }
        } finally {
            rw.writeLock().unlock();
        }

        if (log.isTraceEnabled()) log.trace("learned {} chains from: {}", windows, s);
    }

    /** Learns each sentence in order, one write-lock section per sentence. */
    public void addSentences(Collection<Sentence> ss) {
        Objects.requireNonNull(ss, "ss");
        for (Sentence s : ss) addSentence(s);
    }

    /**
     * Inserts one chain with its recorded adjacency as read from a snapshot.
     * Used while rebuilding a brain that is not yet shared.
     */
    void restoreChain(Chain c, Collection<Word> before, Collection<Word> after, boolean canStart, boolean canEnd) {
        rw.writeLock().lock();
        try {
            chains.add(c);
            for (int k = 0; k < Chain.LENGTH; k++) {
                wordChains.computeIfAbsent(c.get(k), w -> new ChainSet()).add(c);
            }
            WordSet b = wordsBefore.computeIfAbsent(c, x -> new WordSet());
            for (Word w : before) b.add(w);
            WordSet a = wordsAfter.computeIfAbsent(c, x -> new WordSet());
            for (Word w : after) a.add(w);
            if (canStart) startChains.add(c);
            if (canEnd) endChains.add(c);
        } finally {
            rw.writeLock().unlock();
        }
    }

    // =========================
    // Reading
    // =========================

    /**
     * Runs {@code fn} against a live view of the index while holding the read lock.
     * The view must not escape the call.
     */
    public <T> T read(Function<View, T> fn) {
        Objects.requireNonNull(fn, "fn");
        rw.readLock().lock();
        try {
            return fn.apply(view);
        } finally {
            rw.readLock().unlock();
        }
    }

    public int chainCount() {
        return read(v -> v.chains().size());
    }

    public int wordCount() {
        return read(v -> v.words().size());
    }

    public boolean isEmpty() {
        return chainCount() == 0;
    }

    /** Copy of all learned chains. */
    public Set<Chain> chains() {
        return read(v -> Set.copyOf(chains.asSet()));
    }

    public Set<Chain> startChains() {
        return read(v -> Set.copyOf(startChains.asSet()));
    }

    public Set<Chain> endChains() {
        return read(v -> Set.copyOf(endChains.asSet()));
    }

    public Set<Chain> chainsContaining(Word w) {
        return read(v -> Set.copyOf(v.chainsContaining(w).asSet()));
    }

    public Set<Word> wordsBefore(Chain c) {
        return read(v -> Set.copyOf(v.wordsBefore(c).asSet()));
    }

    public Set<Word> wordsAfter(Chain c) {
        return read(v -> Set.copyOf(v.wordsAfter(c).asSet()));
    }

    /**
     * Read-only access to the live index structures. Only valid inside {@link Brain#read}.
     * Returned sets are the brain's own; callers must not modify them.
     */
    public final class View {

        private final ChainSet none = new ChainSet();
        private final WordSet noWords = new WordSet();

        private View() {}

        public ChainSet chains() {
            return chains;
        }

        public ChainSet chainsContaining(Word w) {
            ChainSet cs = wordChains.get(w);
            return cs == null ? none : cs;
        }

        /** Every word that has a non-empty chain set, in no particular order. */
        public Set<Word> words() {
            return wordChains.keySet();
        }

        public WordSet wordsBefore(Chain c) {
            WordSet ws = wordsBefore.get(c);
            return ws == null ? noWords : ws;
        }

        public WordSet wordsAfter(Chain c) {
            WordSet ws = wordsAfter.get(c);
            return ws == null ? noWords : ws;
        }

        public boolean isStart(Chain c) {
            return startChains.contains(c);
        }

        public boolean isEnd(Chain c) {
            return endChains.contains(c);
        }
    }
}
