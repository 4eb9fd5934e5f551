package meerkat;

import java.util.Optional;

/** Child traversal helpers referenced by the generated {@code *_TreeNode} interfaces. */
public final class TreeNodes {
  public static <V> V accept(TreeNodeInterface node, TreeVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends TreeNodeInterface> nodes, TreeVisitor<V> visitor, V value) {
    for (TreeNodeInterface node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends TreeNodeInterface> node, TreeVisitor<V> visitor, V value) {
    return node.isPresent() ? accept(node.get(), visitor, value) : value;
  }

  private TreeNodes() {}
}
