package irmigrator.codec;

/**
 * Encodes a primitive scalar into a node-table fragment in the current
 * snapshot format.
 *
 * <p>Used by promotion rules to turn an inline attribute value into a full
 * node. The migrator treats the encoder as a black box.
 *
 * @see irmigrator.rule.PromoteToNodeRule
 */
@FunctionalInterface
public interface ValueEncoder {

    /**
     * @param value the scalar value to encode (never null)
     * @return the encoded fragment
     */
    EncodedFragment encode(String value);
}
