/*
 * Copyright 2024 The Ruby Sexp Translator Authors.
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
 */
package org.rubysexp.prism;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node of a prism syntax tree.
 *
 * <p>Nodes are immutable. A node is identified by its {@link NodeKind}, spans the lines of its
 * {@link Location}, and carries the kind-specific fields as {@link Prop} values. A field that is
 * absent in the source (no receiver, no else clause) is simply not set.
 */
public final class Node {

  private final NodeKind kind;
  private final Location location;
  private final Map<Prop, Object> props;

  private Node(NodeKind kind, Location location, Map<Prop, Object> props) {
    this.kind = kind;
    this.location = location;
    this.props = props;
  }

  public static Builder builder(NodeKind kind, Location location) {
    return new Builder(kind, location);
  }

  public NodeKind getKind() {
    return kind;
  }

  public boolean isKind(NodeKind kind) {
    return this.kind == kind;
  }

  public Location getLocation() {
    return location;
  }

  public int getStartLine() {
    return location.startLine();
  }

  public int getEndLine() {
    return location.endLine();
  }

  public boolean hasProp(Prop prop) {
    return props.containsKey(prop);
  }

  public @Nullable Node getNode(Prop prop) {
    checkType(prop, Prop.Type.NODE);
    return (Node) props.get(prop);
  }

  /** Returns the list stored under {@code prop}, or an empty list if none was set. */
  @SuppressWarnings("unchecked")
  public ImmutableList<Node> getNodes(Prop prop) {
    checkType(prop, Prop.Type.NODE_LIST);
    ImmutableList<Node> nodes = (ImmutableList<Node>) props.get(prop);
    return nodes == null ? ImmutableList.of() : nodes;
  }

  public @Nullable String getString(Prop prop) {
    checkType(prop, Prop.Type.STRING);
    return (String) props.get(prop);
  }

  public @Nullable Number getNumber(Prop prop) {
    checkType(prop, Prop.Type.NUMBER);
    return (Number) props.get(prop);
  }

  public @Nullable Location getLocation(Prop prop) {
    checkType(prop, Prop.Type.LOCATION);
    return (Location) props.get(prop);
  }

  public boolean getFlag(Prop prop) {
    checkType(prop, Prop.Type.FLAG);
    return props.containsKey(prop);
  }

  /** Returns a copy of this node with {@code prop} set to {@code value}, or cleared if null. */
  @CheckReturnValue
  public Node withProp(Prop prop, @Nullable Object value) {
    Builder builder = toBuilder();
    builder.put(prop, value);
    return builder.build();
  }

  /** Returns a copy of this node spanning the given lines. */
  @CheckReturnValue
  public Node atLines(int startLine, int endLine) {
    return new Node(kind, Location.lines(startLine, endLine), props);
  }

  /** Returns a copy of this node spanning the single given line. */
  @CheckReturnValue
  public Node atLine(int line) {
    return atLines(line, line);
  }

  public Builder toBuilder() {
    Builder builder = new Builder(kind, location);
    builder.props.putAll(props);
    return builder;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append('@').append(location);
    String name = props.containsKey(Prop.NAME) ? (String) props.get(Prop.NAME) : null;
    if (name != null) {
      sb.append(' ').append(name);
    }
    return sb.toString();
  }

  private static void checkType(Prop prop, Prop.Type type) {
    checkArgument(prop.getType() == type, "%s does not hold a %s", prop, type);
  }

  /** Accumulates the fields of a node under construction. */
  public static final class Builder {
    private final NodeKind kind;
    private final Location location;
    private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);

    private Builder(NodeKind kind, Location location) {
      this.kind = checkNotNull(kind);
      this.location = checkNotNull(location);
    }

    /** Sets {@code prop}; a null value (or a false flag) clears it. */
    @CanIgnoreReturnValue
    public Builder put(Prop prop, @Nullable Object value) {
      if (value == null || Boolean.FALSE.equals(value)) {
        props.remove(prop);
        return this;
      }
      props.put(prop, checkValue(prop, value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder flag(Prop prop) {
      return put(prop, Boolean.TRUE);
    }

    public Node build() {
      return new Node(kind, location, new EnumMap<>(props));
    }

    private static Object checkValue(Prop prop, Object value) {
      switch (prop.getType()) {
        case NODE:
          checkArgument(value instanceof Node, "%s expects a node, got %s", prop, value);
          return value;
        case NODE_LIST:
          checkArgument(value instanceof List, "%s expects a node list, got %s", prop, value);
          for (Object element : (List<?>) value) {
            checkArgument(element instanceof Node, "%s expects nodes, got %s", prop, element);
          }
          return ImmutableList.copyOf((List<?>) value);
        case STRING:
          checkArgument(value instanceof String, "%s expects a string, got %s", prop, value);
          return value;
        case NUMBER:
          checkArgument(value instanceof Number, "%s expects a number, got %s", prop, value);
          return value;
        case LOCATION:
          checkArgument(value instanceof Location, "%s expects a location, got %s", prop, value);
          return value;
        case FLAG:
          checkArgument(value instanceof Boolean, "%s expects a flag, got %s", prop, value);
          return value;
      }
      throw new AssertionError(prop.getType());
    }
  }
}
