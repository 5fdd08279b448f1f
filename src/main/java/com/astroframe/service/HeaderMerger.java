package com.astroframe.service;

import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderSet;
import com.astroframe.model.MergeOptions;
import com.astroframe.model.MergeResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits a list of headers into the cards they all share and, per input, the
 * cards left over. Stateless: one instance can be shared by any number of
 * frames.
 */
public class HeaderMerger {

    private static final Logger LOG = Logger.getLogger(HeaderMerger.class.getName());

    public MergeResult merge(HeaderSet... headers) {
        return merge(Arrays.asList(headers), MergeOptions.DEFAULT);
    }

    public MergeResult merge(MergeOptions options, HeaderSet... headers) {
        return merge(Arrays.asList(headers), options);
    }

    /**
     * Every card of every input ends up either in the common header or in the
     * residual of the input it came from. Common cards keep the order in which
     * they are first met scanning the inputs left to right; residual cards keep
     * their order within their input.
     */
    public MergeResult merge(List<HeaderSet> headers, MergeOptions options) {
        if (options == null) options = MergeOptions.DEFAULT;
        if (headers == null || headers.isEmpty()) return MergeResult.EMPTY;

        int n = headers.size();
        if (n == 1) {
            List<HeaderSet> residuals = options.forceReturnDiffs
                    ? Collections.singletonList(HeaderSet.EMPTY)
                    : Collections.<HeaderSet>emptyList();
            return new MergeResult(headers.get(0), residuals);
        }

        // identity -> first position, one lookup per input
        List<Map<HeaderCard, Integer>> positions = new ArrayList<>(n);
        // keyword -> inputs using it, for the mergeUnique keyword check
        Map<String, Set<Integer>> keywordOwners = new HashMap<>();
        // first-seen order over the concatenation of the inputs
        Map<HeaderCard, HeaderCard> union = new LinkedHashMap<>();

        for (int i = 0; i < n; i++) {
            Map<HeaderCard, Integer> lookup = new HashMap<>();
            List<HeaderCard> cards = headers.get(i).cards();
            for (int p = 0; p < cards.size(); p++) {
                HeaderCard c = cards.get(p);
                lookup.putIfAbsent(c, p);
                union.putIfAbsent(c, c);
                keywordOwners.computeIfAbsent(c.getKeyword(), k -> new HashSet<>()).add(i);
            }
            positions.add(lookup);
        }

        List<boolean[]> removed = new ArrayList<>(n);
        for (HeaderSet h : headers) removed.add(new boolean[h.size()]);

        HeaderSet.Builder common = HeaderSet.builder();
        int promotedUnique = 0;
        for (HeaderCard card : union.keySet()) {
            List<Integer> holders = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                if (positions.get(i).containsKey(card)) holders.add(i);
            }

            boolean everywhere = holders.size() == n;
            boolean unique = options.mergeUnique && holders.size() == 1
                    && (card.isCommentary() || keywordOwners.get(card.getKeyword()).size() == 1);
            if (!everywhere && !unique) continue;

            common.add(card);
            if (unique) promotedUnique++;
            for (int i : holders) {
                removed.get(i)[positions.get(i).get(card)] = true;
            }
        }

        List<HeaderSet> residuals = new ArrayList<>(n);
        boolean anyLeft = false;
        for (int i = 0; i < n; i++) {
            HeaderSet.Builder rest = HeaderSet.builder();
            List<HeaderCard> cards = headers.get(i).cards();
            boolean[] gone = removed.get(i);
            for (int p = 0; p < cards.size(); p++) {
                if (!gone[p]) rest.add(cards.get(p));
            }
            anyLeft |= rest.size() > 0;
            residuals.add(rest.build());
        }

        HeaderSet merged = common.build();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Merged %d headers: %d common cards (%d promoted as unique), differences=%b",
                    n, merged.size(), promotedUnique, anyLeft));
        }

        if (!anyLeft && !options.forceReturnDiffs) {
            return new MergeResult(merged, Collections.<HeaderSet>emptyList());
        }
        return new MergeResult(merged, residuals);
    }
}
