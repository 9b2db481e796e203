package com.flow.discovery.service.cut;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Union-find over activity labels.
 */
final class DisjointSets {

    private final Map<String, String> parent = new HashMap<>();

    DisjointSets(Collection<String> elements) {
        elements.forEach(element -> parent.put(element, element));
    }

    String find(String element) {
        String root = element;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        // path compression
        String current = element;
        while (!current.equals(root)) {
            String next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        // smaller label becomes the root so results stay deterministic
        if (rootA.compareTo(rootB) < 0) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootA, rootB);
        }
    }

    /**
     * The current sets, ordered by their smallest element.
     */
    List<SortedSet<String>> sets() {
        var byRoot = new TreeMap<String, SortedSet<String>>();
        for (String element : parent.keySet()) {
            byRoot.computeIfAbsent(find(element), k -> new TreeSet<>()).add(element);
        }
        return new ArrayList<>(byRoot.values());
    }
}
