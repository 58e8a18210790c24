package irmigrator.tvm;

import irmigrator.codec.ValueEncoder;
import irmigrator.plan.VersionChain;
import irmigrator.plan.VersionRuleSet;
import irmigrator.rule.NodeField;
import irmigrator.rule.RewriteRule;

import java.util.List;
import java.util.Objects;

import static irmigrator.rule.RewriteRule.crossReference;
import static irmigrator.rule.RewriteRule.defaultFill;
import static irmigrator.rule.RewriteRule.move;
import static irmigrator.rule.RewriteRule.promote;
import static irmigrator.rule.RewriteRule.rename;

/**
 * Rule sets of the IR snapshot format history: {@code 0.6 -> 0.7 -> 0.8 -> 0.9}.
 *
 * <ul>
 *   <li>{@code 0.6 -> 0.7}: relay and TIR types move to their own namespaces,
 *       inline name strings become {@code runtime.String} nodes, type variables
 *       absorb the name of the variable node they used to point at</li>
 *   <li>{@code 0.7 -> 0.8}: {@code IRModule} gains an {@code attrs} slot</li>
 *   <li>{@code 0.8 -> 0.9}: relay expressions gain a {@code virtual_device_} slot</li>
 * </ul>
 *
 * <p>All rule sets are built fresh on each call and share nothing.
 */
public final class TvmRuleSets {

    public static final String V0_6 = "0.6";
    public static final String V0_7 = "0.7";
    public static final String V0_8 = "0.8";
    public static final String V0_9 = "0.9";

    /** Index of the null node; used as the value of an unset object field. */
    private static final String NULL_REF = "0";

    private static final List<String> TIR_RENAMES = List.of(
            "Cast", "Add", "Sub", "Mul", "Div", "Mod", "FloorDiv", "FloorMod",
            "Min", "Max", "EQ", "NE", "LT", "LE", "GT", "GE", "And", "Or", "Not",
            "Select", "BufferLoad", "Ramp", "Broadcast", "Shuffle", "Let", "Any",
            "LetStmt", "AssertStmt", "BufferStore", "BufferRealize", "Allocate",
            "IfThenElse", "Evaluate", "Prefetch");

    private static final List<String> RELAY_TYPE_RENAMES = List.of(
            "Type", "TupleType", "TypeConstraint", "FuncType", "IncompleteType",
            "TypeRelation", "TypeCall", "SourceName", "Span");

    private static final List<String> RELAY_PASS_RENAMES = List.of(
            "Pass", "PassInfo", "PassContext", "ModulePass", "Sequential");

    private static final List<String> VIRTUAL_DEVICE_TYPES = List.of(
            "GlobalVar", "relay.Var", "relay.Function", "relay.Tuple", "relay.Call",
            "relay.Let", "relay.If", "relay.TupleGetItem", "relay.RefCreate",
            "relay.RefRead", "relay.RefWrite", "relay.Match", "relay.Constant");

    private TvmRuleSets() {}

    /**
     * Builds the full chain {@code 0.6 -> 0.7 -> 0.8 -> 0.9}.
     *
     * @param encoder value encoder used to promote inline strings
     * @return the chain, terminal version {@value #V0_9}
     */
    public static VersionChain defaultChain(ValueEncoder encoder) {
        return VersionChain.build(List.of(
                updater06To07(encoder),
                updater07To08(),
                updater08To09()));
    }

    /**
     * {@code 0.6 -> 0.7}: namespace renames, string promotion, type-variable
     * name inlining and {@code global_key} retirement.
     *
     * @param encoder value encoder used to promote inline strings
     */
    public static VersionRuleSet updater06To07(ValueEncoder encoder) {
        Objects.requireNonNull(encoder, "encoder");
        RewriteRule globalKeyToRepr = move(NodeField.GLOBAL_KEY, NodeField.REPR_STR);
        RewriteRule inlineVarName = crossReference("var", "name", "name_hint");

        VersionRuleSet.Builder b = VersionRuleSet.builder(V0_6, V0_7)
                // base IR
                .on("SourceName", globalKeyToRepr)
                .on("EnvFunc", globalKeyToRepr)
                .on("relay.Op", globalKeyToRepr, rename("Op"))
                .on("relay.TypeVar", inlineVarName, rename("TypeVar"), promote("name_hint", encoder))
                .on("TypeVar", promote("name_hint", encoder))
                .on("relay.Id", promote("name_hint", encoder))
                .on("relay.GlobalTypeVar", inlineVarName, rename("GlobalTypeVar"), promote("name_hint", encoder))
                .on("GlobalTypeVar", promote("name_hint", encoder))
                .on("relay.Constructor", promote("name_hint", encoder))
                .on("relay.Module", rename("IRModule"))
                .on("relay.GlobalVar", rename("GlobalVar"), promote("name_hint", encoder))
                .on("GlobalVar", promote("name_hint", encoder))
                .on("StrMap", rename("Map"))
                // TIR
                .on("Variable", rename("tir.Var"), defaultFill("tir.Var", "type_annotation", NULL_REF),
                        promote("name", encoder))
                .on("SizeVar", rename("tir.SizeVar"), defaultFill("tir.SizeVar", "type_annotation", NULL_REF),
                        promote("name", encoder))
                .on("StringImm", rename("tir.StringImm"), promote("value", encoder))
                .on("Call", rename("tir.Call"), promote("name", encoder))
                .on("AttrStmt", rename("tir.AttrStmt"), promote("attr_key", encoder))
                .on("Layout", rename("tir.Layout"), promote("name", encoder))
                .on("Buffer", rename("tir.Buffer"), promote("name", encoder), promote("scope", encoder));

        RELAY_TYPE_RENAMES.forEach(t -> b.on("relay." + t, rename(t)));
        RELAY_PASS_RENAMES.forEach(t -> b.on("relay." + t, rename("transform." + t)));
        TIR_RENAMES.forEach(t -> b.on(t, rename("tir." + t)));

        return b.build();
    }

    /**
     * {@code 0.7 -> 0.8}: modules get an empty {@code attrs} dictionary slot.
     */
    public static VersionRuleSet updater07To08() {
        return VersionRuleSet.builder(V0_7, V0_8)
                .on("IRModule", defaultFill("IRModule", "attrs", NULL_REF))
                .build();
    }

    /**
     * {@code 0.8 -> 0.9}: relay expressions get an unset {@code virtual_device_}.
     */
    public static VersionRuleSet updater08To09() {
        VersionRuleSet.Builder b = VersionRuleSet.builder(V0_8, V0_9);
        RewriteRule fill = defaultFill("virtual_device_", NULL_REF);
        VIRTUAL_DEVICE_TYPES.forEach(t -> b.on(t, fill));
        return b.build();
    }
}
