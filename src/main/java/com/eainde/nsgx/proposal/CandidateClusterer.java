package com.eainde.nsgx.proposal;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy single-pass clustering of key groups within one category.
 *
 * <p>Groups are visited in the order given (first-seen order). The first unabsorbed
 * group seeds a cluster and absorbs every later unabsorbed group whose key scores
 * {@code >=} the threshold against the seed key. An absorbed group is never
 * reconsidered, so the partition depends on visiting order; this is a known
 * approximation, not an optimal clustering.</p>
 */
public class CandidateClusterer {

    private final double similarityThreshold;

    public CandidateClusterer(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    List<List<KeyGroup>> cluster(List<KeyGroup> groups) {
        List<List<KeyGroup>> clusters = new ArrayList<>();
        boolean[] absorbed = new boolean[groups.size()];
        for (int i = 0; i < groups.size(); i++) {
            if (absorbed[i]) {
                continue;
            }
            KeyGroup seed = groups.get(i);
            List<KeyGroup> cluster = new ArrayList<>();
            cluster.add(seed);
            absorbed[i] = true;
            for (int j = i + 1; j < groups.size(); j++) {
                KeyGroup other = groups.get(j);
                if (!absorbed[j]
                        && seed.category().equals(other.category())
                        && SimilarityScorer.ratio(seed.key(), other.key()) >= similarityThreshold) {
                    cluster.add(other);
                    absorbed[j] = true;
                }
            }
            clusters.add(cluster);
        }
        return clusters;
    }
}
