package me.golemcore.discovery.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed groupings of related expertise domains used for approximate domain
 * matching. Clusters are checked in declaration order and the first hit wins.
 */
final class DomainClusters {

    static final double SAME_CLUSTER_SYNONYMS = 0.8;
    static final double CLUSTER_AND_SYNONYM = 0.9;
    static final double UNRELATED = 0.2;

    private static final Map<String, Set<String>> CLUSTERS = new LinkedHashMap<>();

    static {
        CLUSTERS.put("technology", Set.of("software", "it", "programming", "tech"));
        CLUSTERS.put("finance", Set.of("banking", "trading", "accounting", "fintech"));
        CLUSTERS.put("healthcare", Set.of("medical", "clinical", "pharmaceutical"));
        CLUSTERS.put("marketing", Set.of("advertising", "sales", "promotion"));
        CLUSTERS.put("education", Set.of("learning", "training", "academic"));
    }

    private DomainClusters() {
    }

    /**
     * Similarity of two distinct lowercase domain labels in [0, 1].
     */
    static double similarity(String first, String second) {
        for (Map.Entry<String, Set<String>> cluster : CLUSTERS.entrySet()) {
            String name = cluster.getKey();
            Set<String> synonyms = cluster.getValue();
            if (synonyms.contains(first) && synonyms.contains(second)) {
                return SAME_CLUSTER_SYNONYMS;
            }
            if ((name.equals(first) && synonyms.contains(second))
                    || (name.equals(second) && synonyms.contains(first))) {
                return CLUSTER_AND_SYNONYM;
            }
        }
        return UNRELATED;
    }
}
