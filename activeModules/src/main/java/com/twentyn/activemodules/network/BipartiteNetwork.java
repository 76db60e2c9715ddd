/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.activemodules.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An immutable bipartite network of metabolites and reactions.  Every edge joins a metabolite to a reaction; the
 * constructor rejects anything else.  All enumeration methods return nodes in id order, so that any search built
 * on top of this class is deterministic.
 */
public class BipartiteNetwork {

  private static final Logger LOGGER = LogManager.getFormatterLogger(BipartiteNetwork.class);

  private final SortedMap<String, NetworkNode> nodeIndex;
  private final List<NetworkEdge> edges;
  private final Map<String, SortedSet<String>> adjacency;

  /**
   * Builds the network, validating bipartiteness.  Edges may be given in either orientation; they are stored with
   * the metabolite as source.
   *
   * @param nodes The nodes.
   * @param edges The edges between them.
   * @throws StructuralException on duplicate nodes or edges, edges to unknown nodes, or same-type edges.
   */
  public BipartiteNetwork(Collection<NetworkNode> nodes, Collection<NetworkEdge> edges) {
    this.nodeIndex = new TreeMap<>();
    for (NetworkNode node : nodes) {
      if (nodeIndex.containsKey(node.getId())) {
        throw new StructuralException(node.getId(), "Duplicate node id " + node.getId());
      }
      nodeIndex.put(node.getId(), node);
    }

    this.adjacency = new HashMap<>();
    nodeIndex.keySet().forEach(id -> adjacency.put(id, new TreeSet<>()));

    Set<NetworkEdge> seen = new HashSet<>();
    List<NetworkEdge> canonicalEdges = new ArrayList<>(edges.size());
    for (NetworkEdge edge : edges) {
      NetworkEdge canonical = canonicalize(edge);
      if (!seen.add(canonical)) {
        throw new StructuralException(canonical.getId(), "Duplicate edge " + canonical.getId());
      }
      canonicalEdges.add(canonical);
      adjacency.get(canonical.getSource()).add(canonical.getTarget());
      adjacency.get(canonical.getTarget()).add(canonical.getSource());
    }
    Collections.sort(canonicalEdges);
    this.edges = Collections.unmodifiableList(canonicalEdges);

    LOGGER.debug("Built bipartite network with %d nodes and %d edges", nodeIndex.size(), this.edges.size());
  }

  private NetworkEdge canonicalize(NetworkEdge edge) {
    NetworkNode source = nodeIndex.get(edge.getSource());
    NetworkNode target = nodeIndex.get(edge.getTarget());
    if (source == null) {
      throw new StructuralException(edge.getSource(),
          String.format("Edge %s references unknown node %s", edge.getId(), edge.getSource()));
    }
    if (target == null) {
      throw new StructuralException(edge.getTarget(),
          String.format("Edge %s references unknown node %s", edge.getId(), edge.getTarget()));
    }
    if (source.getType() == target.getType()) {
      throw new StructuralException(edge.getId(), String.format(
          "Edge %s joins two %s nodes; only metabolite-reaction edges are allowed",
          edge.getId(), source.getType().getName()));
    }
    return source.isMetabolite() ? edge : new NetworkEdge(target.getId(), source.getId());
  }

  public NetworkNode getNodeById(String id) {
    NetworkNode result = nodeIndex.get(id);
    if (result == null) {
      throw new NodeNotFoundException(id);
    }
    return result;
  }

  public Optional<NetworkNode> getNodeOptionById(String id) {
    return Optional.ofNullable(nodeIndex.get(id));
  }

  public boolean containsNode(String id) {
    return nodeIndex.containsKey(id);
  }

  /**
   * @return An unmodifiable, id-ordered collection of all nodes.
   */
  public Collection<NetworkNode> getNodes() {
    return Collections.unmodifiableCollection(nodeIndex.values());
  }

  /**
   * Get all edges from the graph, metabolite first, sorted.
   *
   * @return An unmodifiable list of the graph's edges.
   */
  public List<NetworkEdge> getEdges() {
    return edges;
  }

  public List<NetworkNode> getMetabolites() {
    return nodeIndex.values().stream().filter(NetworkNode::isMetabolite).collect(Collectors.toList());
  }

  public List<NetworkNode> getReactions() {
    return nodeIndex.values().stream().filter(NetworkNode::isReaction).collect(Collectors.toList());
  }

  /**
   * @return The ids of all nodes adjacent to the given node, in id order.
   */
  public SortedSet<String> getNeighbors(String id) {
    SortedSet<String> neighbors = adjacency.get(id);
    if (neighbors == null) {
      throw new NodeNotFoundException(id);
    }
    return Collections.unmodifiableSortedSet(neighbors);
  }

  public int getDegree(String id) {
    return getNeighbors(id).size();
  }

  /**
   * Breadth-first search from a single node.
   *
   * @param id The start node.
   * @param hops The maximum hop distance, 0 or more.
   * @return Map from every node within the given number of hops to its distance, in BFS order.
   */
  public Map<String, Integer> getNodesWithinHops(String id, int hops) {
    return getNodesWithinHops(Collections.singleton(id), hops);
  }

  /**
   * Multi-source breadth-first search: distances are measured to the nearest source.
   *
   * @param sources The start nodes, all at distance 0.
   * @param hops The maximum hop distance, 0 or more.
   * @return Map from every node within the given number of hops of any source to its distance, in BFS order.
   */
  public Map<String, Integer> getNodesWithinHops(Collection<String> sources, int hops) {
    Map<String, Integer> distances = new LinkedHashMap<>();
    findShortestPaths(sources, hops).forEach((node, path) -> distances.put(node, path.size()));
    return distances;
  }

  /**
   * Finds, for every node within the given number of hops of the source set, one shortest path from the nearest
   * source.  Ties are broken by visiting sources and neighbors in id order, so the chosen path is deterministic.
   *
   * @param sources The start nodes.
   * @param hops The maximum hop distance.
   * @return Map from node id to the path leading to it: the nodes after the source, ending with the node itself.
   * Sources map to an empty path.  Entries are in BFS order.
   */
  public Map<String, List<String>> findShortestPaths(Collection<String> sources, int hops) {
    if (hops < 0) {
      throw new IllegalArgumentException("Hop count must be non-negative, got " + hops);
    }
    Map<String, String> parents = new LinkedHashMap<>();
    Map<String, Integer> distances = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String source : new TreeSet<>(sources)) {
      getNodeById(source);
      parents.put(source, null);
      distances.put(source, 0);
      queue.add(source);
    }

    while (!queue.isEmpty()) {
      String current = queue.poll();
      int distance = distances.get(current);
      if (distance >= hops) {
        continue;
      }
      for (String neighbor : adjacency.get(current)) {
        if (!parents.containsKey(neighbor)) {
          parents.put(neighbor, current);
          distances.put(neighbor, distance + 1);
          queue.add(neighbor);
        }
      }
    }

    Map<String, List<String>> paths = new LinkedHashMap<>();
    for (String node : parents.keySet()) {
      LinkedList<String> path = new LinkedList<>();
      for (String step = node; parents.get(step) != null; step = parents.get(step)) {
        path.addFirst(step);
      }
      paths.put(node, path);
    }
    return paths;
  }

  /**
   * Tests whether the subgraph induced by the given nodes is connected.  The empty set is not connected.
   */
  public boolean isConnected(Set<String> ids) {
    if (ids.isEmpty()) {
      return false;
    }
    ids.forEach(this::getNodeById);
    String start = ids.iterator().next();
    Set<String> visited = new HashSet<>();
    Deque<String> stack = new ArrayDeque<>();
    stack.push(start);
    visited.add(start);
    while (!stack.isEmpty()) {
      String current = stack.pop();
      for (String neighbor : adjacency.get(current)) {
        if (ids.contains(neighbor) && visited.add(neighbor)) {
          stack.push(neighbor);
        }
      }
    }
    return visited.size() == ids.size();
  }

  /**
   * @return The edges with both endpoints in the given set, in network order.
   */
  public List<NetworkEdge> getInducedEdges(Set<String> ids) {
    return edges.stream()
        .filter(e -> ids.contains(e.getSource()) && ids.contains(e.getTarget()))
        .collect(Collectors.toList());
  }

  /**
   * @return Every connected component as an id-sorted set, largest first; equal sizes are ordered by smallest id.
   */
  public List<SortedSet<String>> getConnectedComponents() {
    List<SortedSet<String>> components = new ArrayList<>();
    Set<String> assigned = new HashSet<>();
    for (String id : nodeIndex.keySet()) {
      if (assigned.contains(id)) {
        continue;
      }
      SortedSet<String> component = new TreeSet<>(getNodesWithinHops(id, Integer.MAX_VALUE).keySet());
      assigned.addAll(component);
      components.add(component);
    }
    components.sort(Comparator.<SortedSet<String>>comparingInt(Set::size).reversed()
        .thenComparing(SortedSet::first));
    return components;
  }

  /**
   * Restricts the network to its largest connected component.
   *
   * @return The main component as its own network; this network if it is empty or already connected.
   */
  public BipartiteNetwork getLargestComponent() {
    List<SortedSet<String>> components = getConnectedComponents();
    if (components.size() <= 1) {
      return this;
    }
    LOGGER.info("Restricting network to its main component: %d of %d nodes in %d components",
        components.get(0).size(), nodeIndex.size(), components.size());
    return getSubnetwork(components.get(0));
  }

  /**
   * @return The subnetwork induced by the given node ids.
   */
  public BipartiteNetwork getSubnetwork(Set<String> ids) {
    List<NetworkNode> nodes = ids.stream().map(this::getNodeById).collect(Collectors.toList());
    return new BipartiteNetwork(nodes, getInducedEdges(ids));
  }

  /**
   * @return The ids of all study measurements present anywhere in the network, sorted.
   */
  public SortedSet<String> getStudyIds() {
    SortedSet<String> studies = new TreeSet<>();
    nodeIndex.values().forEach(n -> studies.addAll(n.getMeasurements().keySet()));
    return studies;
  }
}
