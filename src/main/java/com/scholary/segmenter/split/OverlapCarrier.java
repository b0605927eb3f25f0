package com.scholary.segmenter.split;

import com.scholary.segmenter.alignment.WordAlignmentMatcher;
import com.scholary.segmenter.alignment.WordSelection;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.timing.TimeRange;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Re-injects cross-speaker overlap into a group opened after a rollback.
 *
 * <p>When a group is seeded by an utterance that was pushed out of the previous group, other
 * speakers may have been talking at the moment it starts. Their words from the seed start onward
 * are extracted at word boundaries and added to the new group as overlap fragments, so the new
 * sub-segment keeps that context.
 */
@Component
public class OverlapCarrier {

  static final String FRAGMENT_SUFFIX = "_ovl";

  private final WordAlignmentMatcher matcher;

  public OverlapCarrier(WordAlignmentMatcher matcher) {
    this.matcher = matcher;
  }

  /**
   * Extract overlap fragments for a freshly seeded group.
   *
   * @param closedGroup entries of the group closed just before the rollback
   * @param seed the entry that opened the new group
   * @param maxLen maximum sub-segment length in seconds
   * @param pendingSourceIds ids of input utterances still waiting to be scanned; these are
   *     skipped because they will be added in full
   * @param groupSize size of the new group before the fragments, used to derive fragment ids
   * @return fragments to append, possibly empty
   */
  List<GroupEntry> carry(
      List<GroupEntry> closedGroup,
      GroupEntry seed,
      double maxLen,
      Set<String> pendingSourceIds,
      int groupSize) {

    double seedStart = seed.span().start();
    TimeRange window = TimeRange.window(seedStart, maxLen);
    Set<String> visited = new HashSet<>();
    List<GroupEntry> fragments = new ArrayList<>();

    for (GroupEntry candidate : closedGroup) {
      UtteranceSpan source = candidate.source();
      if (!overlaps(source, seed, pendingSourceIds) || !visited.add(source.id())) {
        continue;
      }
      WordSelection selection = matcher.select(source, window);
      if (!selection.hasSelection()) {
        continue;
      }
      String fragmentId =
          source.id() + "-" + candidate.position() + "-" + (groupSize + fragments.size())
              + FRAGMENT_SUFFIX;
      UtteranceSpan fragment =
          source
              .withId(fragmentId)
              .withContent(
                  selection.firstStart(),
                  selection.lastEnd() - selection.firstStart(),
                  selection.text(),
                  selection.words());
      fragments.add(GroupEntry.fragment(fragment, source, candidate.position()));
    }
    return fragments;
  }

  /**
   * An utterance overlaps the seed when it is active at the seed start, belongs to another
   * speaker, and is a different input utterance that is not queued for scanning.
   */
  private boolean overlaps(UtteranceSpan source, GroupEntry seed, Set<String> pendingSourceIds) {
    return source.range().isActiveAt(seed.span().start())
        && !Objects.equals(source.speakerId(), seed.speakerId())
        && !source.id().equals(seed.source().id())
        && !pendingSourceIds.contains(source.id());
  }
}
