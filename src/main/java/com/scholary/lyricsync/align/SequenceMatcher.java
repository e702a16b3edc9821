package com.scholary.lyricsync.align;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Longest-matching-block diff over two token sequences.
 *
 * <p>The matcher repeatedly finds the longest contiguous block shared by {@code a} and {@code b},
 * then recurses into the regions left and right of it. The resulting blocks describe how to turn
 * {@code a} into {@code b} as a list of {@link Opcode}s. This is the same matching strategy that
 * generic text-diff tools use; it favours long runs over scattered single-token matches, which is
 * what we want when aligning lyric words against recognizer words.
 *
 * <p>Example: a = ["the", "quick", "brown", "fox"], b = ["brown", "fox", "jumps"] yields one
 * block (2, 0, 2) and the opcodes DELETE a[0:2], EQUAL a[2:4]/b[0:2], INSERT b[2:3].
 *
 * <p>Instances are not thread-safe; build one per comparison.
 *
 * @param <T> token type, compared with {@code equals}
 */
public class SequenceMatcher<T> {

  /** Below this size of {@code b} the popular-token heuristic never applies. */
  static final int AUTO_JUNK_MIN_SIZE = 200;

  /**
   * A block of equal tokens.
   *
   * @param a start index in the first sequence
   * @param b start index in the second sequence
   * @param size number of equal tokens
   */
  public record Match(int a, int b, int size) {

    public boolean hasMatch() {
      return size > 0;
    }
  }

  public enum Tag {
    EQUAL,
    REPLACE,
    DELETE,
    INSERT
  }

  /**
   * One edit step: {@code a[a1:a2]} relates to {@code b[b1:b2]} as described by the tag.
   */
  public record Opcode(Tag tag, int a1, int a2, int b1, int b2) {}

  private final List<T> a;
  private final List<T> b;
  private final Map<T, List<Integer>> bIndex = new HashMap<>();
  private List<Match> matchingBlocks;

  public SequenceMatcher(List<T> a, List<T> b) {
    this(a, b, true);
  }

  /**
   * @param a first sequence
   * @param b second sequence
   * @param autoJunk when {@code b} has at least 200 tokens, ignore tokens occurring more than
   *     {@code len(b) / 100 + 1} times when seeding matches
   */
  public SequenceMatcher(List<T> a, List<T> b, boolean autoJunk) {
    this.a = List.copyOf(a);
    this.b = List.copyOf(b);
    indexB(autoJunk);
  }

  private void indexB(boolean autoJunk) {
    for (int j = 0; j < b.size(); j++) {
      bIndex.computeIfAbsent(b.get(j), k -> new ArrayList<>()).add(j);
    }
    if (autoJunk && b.size() >= AUTO_JUNK_MIN_SIZE) {
      int threshold = b.size() / 100 + 1;
      bIndex.values().removeIf(positions -> positions.size() > threshold);
    }
  }

  /**
   * Find the longest block of equal tokens in {@code a[alo:ahi]} and {@code b[blo:bhi]}.
   *
   * <p>If several blocks are maximal, the one starting earliest in {@code a} wins, and of those
   * the one starting earliest in {@code b}.
   *
   * @return the block, with size 0 if the ranges share nothing
   */
  public Match findLongestMatch(int alo, int ahi, int blo, int bhi) {
    int bestI = alo;
    int bestJ = blo;
    int bestSize = 0;

    // lengths of matches ending at b[j] for the previous row of a
    Map<Integer, Integer> lengthAt = new HashMap<>();
    for (int i = alo; i < ahi; i++) {
      Map<Integer, Integer> nextLengthAt = new HashMap<>();
      for (int j : bIndex.getOrDefault(a.get(i), List.of())) {
        if (j < blo) {
          continue;
        }
        if (j >= bhi) {
          break;
        }
        int k = lengthAt.getOrDefault(j - 1, 0) + 1;
        nextLengthAt.put(j, k);
        if (k > bestSize) {
          bestI = i - k + 1;
          bestJ = j - k + 1;
          bestSize = k;
        }
      }
      lengthAt = nextLengthAt;
    }

    // Popular tokens never seed a match but may still extend one.
    while (bestI > alo && bestJ > blo && a.get(bestI - 1).equals(b.get(bestJ - 1))) {
      bestI--;
      bestJ--;
      bestSize++;
    }
    while (bestI + bestSize < ahi
        && bestJ + bestSize < bhi
        && a.get(bestI + bestSize).equals(b.get(bestJ + bestSize))) {
      bestSize++;
    }

    return new Match(bestI, bestJ, bestSize);
  }

  /** Longest block over the full sequences. */
  public Match findLongestMatch() {
    return findLongestMatch(0, a.size(), 0, b.size());
  }

  /**
   * All matching blocks, in increasing order of both indices.
   *
   * <p>Adjacent blocks are collapsed into one. The last element is always the sentinel
   * {@code (len(a), len(b), 0)}.
   */
  public List<Match> getMatchingBlocks() {
    if (matchingBlocks != null) {
      return matchingBlocks;
    }

    List<Match> found = new ArrayList<>();
    Deque<int[]> pending = new ArrayDeque<>();
    pending.push(new int[] {0, a.size(), 0, b.size()});
    while (!pending.isEmpty()) {
      int[] range = pending.pop();
      int alo = range[0];
      int ahi = range[1];
      int blo = range[2];
      int bhi = range[3];
      Match match = findLongestMatch(alo, ahi, blo, bhi);
      if (match.hasMatch()) {
        found.add(match);
        if (alo < match.a() && blo < match.b()) {
          pending.push(new int[] {alo, match.a(), blo, match.b()});
        }
        if (match.a() + match.size() < ahi && match.b() + match.size() < bhi) {
          pending.push(new int[] {match.a() + match.size(), ahi, match.b() + match.size(), bhi});
        }
      }
    }
    found.sort(Comparator.comparingInt(Match::a).thenComparingInt(Match::b));

    List<Match> collapsed = new ArrayList<>();
    int i1 = 0;
    int j1 = 0;
    int k1 = 0;
    for (Match block : found) {
      if (i1 + k1 == block.a() && j1 + k1 == block.b()) {
        k1 += block.size();
      } else {
        if (k1 > 0) {
          collapsed.add(new Match(i1, j1, k1));
        }
        i1 = block.a();
        j1 = block.b();
        k1 = block.size();
      }
    }
    if (k1 > 0) {
      collapsed.add(new Match(i1, j1, k1));
    }
    collapsed.add(new Match(a.size(), b.size(), 0));

    matchingBlocks = List.copyOf(collapsed);
    return matchingBlocks;
  }

  /** Edit steps turning {@code a} into {@code b}, covering both sequences end to end. */
  public List<Opcode> getOpcodes() {
    List<Opcode> opcodes = new ArrayList<>();
    int i = 0;
    int j = 0;
    for (Match block : getMatchingBlocks()) {
      Tag tag = null;
      if (i < block.a() && j < block.b()) {
        tag = Tag.REPLACE;
      } else if (i < block.a()) {
        tag = Tag.DELETE;
      } else if (j < block.b()) {
        tag = Tag.INSERT;
      }
      if (tag != null) {
        opcodes.add(new Opcode(tag, i, block.a(), j, block.b()));
      }
      i = block.a() + block.size();
      j = block.b() + block.size();
      if (block.hasMatch()) {
        opcodes.add(new Opcode(Tag.EQUAL, block.a(), i, block.b(), j));
      }
    }
    return opcodes;
  }
}
