package org.metricshub.jst.ladder;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jst
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes and edges of a ladder diagram, rungs stacked from top to bottom.
 * <p>
 * Node and edge ids are unique: a node added with an id already in use gets
 * an ordinal suffix, and an edge that already exists is not added twice.
 */
public class LadderGraph {

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private final Map<String, LadderNode> nodes = new LinkedHashMap<String, LadderNode>();
	private final Map<String, LadderEdge> edges = new LinkedHashMap<String, LadderEdge>();

	LadderNode addNode(String id, LadderNodeType type, int x, int y, Map<String, Object> data) {
		String unique = id;
		for (int ordinal = 2; nodes.containsKey(unique); ordinal++) {
			unique = id + "#" + ordinal;
		}
		LadderNode node = new LadderNode(unique, type, x, y, data);
		nodes.put(unique, node);
		return node;
	}

	void addEdge(String source, String target) {
		LadderEdge edge = new LadderEdge(source, target);
		if (!edges.containsKey(edge.getId())) {
			edges.put(edge.getId(), edge);
		}
	}

	public List<LadderNode> getNodes() {
		return Collections.unmodifiableList(new ArrayList<LadderNode>(nodes.values()));
	}

	public List<LadderEdge> getEdges() {
		return Collections.unmodifiableList(new ArrayList<LadderEdge>(edges.values()));
	}

	/**
	 * @param id node id
	 * @return the node, or {@code null}
	 */
	public LadderNode getNode(String id) {
		return nodes.get(id);
	}

	/**
	 * @param type a node type
	 * @return the nodes of that type, in insertion order
	 */
	public List<LadderNode> getNodes(LadderNodeType type) {
		List<LadderNode> result = new ArrayList<LadderNode>();
		for (LadderNode node : nodes.values()) {
			if (node.getType() == type) {
				result.add(node);
			}
		}
		return result;
	}

	/**
	 * @param nodeId a node id
	 * @return the ids of the nodes wired to the output of that node
	 */
	public List<String> getSuccessors(String nodeId) {
		List<String> result = new ArrayList<String>();
		for (LadderEdge edge : edges.values()) {
			if (edge.getSource().equals(nodeId)) {
				result.add(edge.getTarget());
			}
		}
		return result;
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	/**
	 * @return <code>{"nodes": [...], "edges": [...]}</code>, pretty printed
	 */
	public String toJson() {
		Map<String, Object> document = new LinkedHashMap<String, Object>();
		document.put("nodes", new ArrayList<LadderNode>(nodes.values()));
		document.put("edges", new ArrayList<LadderEdge>(edges.values()));
		return GSON.toJson(document);
	}
}
