package meerkat;

public interface TreeNodeInterface {
  <V> V accept(TreeVisitor<V> visitor, V value);

  <V> V visitChildren(TreeVisitor<V> visitor, V value);
}
