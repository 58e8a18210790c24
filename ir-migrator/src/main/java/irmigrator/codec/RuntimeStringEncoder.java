package irmigrator.codec;

import irmigrator.graph.Node;

import java.util.List;

/**
 * Encodes strings the way the current format serializes a standalone
 * {@code runtime.String}: a null node at index 0 followed by the string node
 * carrying the value in {@code repr_str}.
 */
public final class RuntimeStringEncoder implements ValueEncoder {

    public static final String TYPE_KEY = "runtime.String";

    @Override
    public EncodedFragment encode(String value) {
        Node string = new Node(TYPE_KEY).reprStr(value);
        return new EncodedFragment(1, List.of(Node.tombstone(), string));
    }
}
