package com.bdfrenumber.core.scanner;

import com.bdfrenumber.core.util.FileUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Index-addressed arena of include files, root first, in discovery order.
 *
 * <p>Nodes refer to each other by index only, so the tree has no object
 * cycles even when the deck's include statements do.
 */
public final class IncludeTree {

    private final List<IncludeFileNode> nodes;

    public IncludeTree(List<IncludeFileNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("an include tree needs a root file");
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).index() != i) {
                throw new IllegalArgumentException("node at position " + i + " has index " + nodes.get(i).index());
            }
        }
        this.nodes = List.copyOf(nodes);
    }

    public IncludeFileNode root() {
        return nodes.get(0);
    }

    public IncludeFileNode node(int index) {
        return nodes.get(index);
    }

    /**
     * All files in discovery order.
     *
     * @return nodes, root first
     */
    public List<IncludeFileNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Files directly included by a file.
     *
     * @param index parent index
     * @return child nodes in statement order
     */
    public List<IncludeFileNode> children(int index) {
        return nodes.get(index).childIndices().stream().map(nodes::get).toList();
    }

    /**
     * Looks up a file by path.
     *
     * @param path file path
     * @return node index, or -1 when the file is not in the tree
     */
    public int indexOf(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        for (IncludeFileNode node : nodes) {
            if (node.path().equals(normalized)) {
                return node.index();
            }
        }
        return -1;
    }

    /**
     * Directory of the root file; every other name is relative to it.
     *
     * @return root directory
     */
    public Path rootDirectory() {
        return root().path().getParent();
    }

    /**
     * Name of a file relative to the root directory, with forward slashes.
     *
     * @param index node index
     * @return relative name, e.g. {@code includes/wing.bdf}
     */
    public String relativeName(int index) {
        return FileUtils.relativeName(rootDirectory(), nodes.get(index).path());
    }

    /**
     * Looks up a file by its relative name.
     *
     * @param relativeName name as returned by {@link #relativeName(int)}
     * @return node index, or -1
     */
    public int indexOfRelative(String relativeName) {
        String wanted = relativeName.replace('\\', '/');
        for (int i = 0; i < nodes.size(); i++) {
            if (relativeName(i).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }
}
