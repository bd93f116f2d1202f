package com.raditha.cogent.extraction;

import com.raditha.cogent.java.JavaFixtures;
import com.raditha.cogent.model.ClosureInfo;
import com.raditha.cogent.model.ExtractionCandidate;
import com.raditha.cogent.model.MutationInfo;
import com.raditha.cogent.model.MutationKind;
import com.raditha.cogent.model.VariableFlowAnalysis;
import com.raditha.cogent.model.VariableInfo;
import com.raditha.cogent.scope.ScopeAnalyzer;
import com.raditha.cogent.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VariableFlowAnalyzerTest {

    private final VariableFlowAnalyzer analyzer = new VariableFlowAnalyzer();

    private VariableFlowAnalysis analyze(String source, String method, int start, int end) {
        SyntaxNode root = JavaFixtures.parse(source);
        SyntaxNode function = JavaFixtures.method(root, method);
        Map<String, VariableInfo> variables = new VariableTracker(ScopeAnalyzer.analyze(root)).track(function);
        ExtractionCandidate candidate = new ExtractionCandidate(start, end, 5, 50, List.of(), Set.of());
        return analyzer.analyze(candidate, variables, function);
    }

    private static List<String> names(List<VariableInfo> variables) {
        return variables.stream().map(VariableInfo::name).toList();
    }

    @Test
    void testInputsOutputsAndInternals() {
        String source = """
                class Prices {
                    int price(int base, int qty, int unused) {
                        int discount = 0;
                        if (qty > 10) {
                            int bulk = qty / 10;
                            discount = bulk * 2;
                        }
                        int net = base - discount;
                        return net;
                    }
                }
                """;
        VariableFlowAnalysis flow = analyze(source, "price", 8, 8);

        assertEquals(List.of("base", "discount"), names(flow.inputs()));
        assertEquals(List.of("net"), names(flow.outputs()));
        assertTrue(flow.internalOnly().isEmpty());

        VariableFlowAnalysis inner = analyze(source, "price", 4, 7);
        assertEquals(List.of("qty"), names(inner.inputs()));
        assertEquals(List.of("bulk"), names(inner.internalOnly()));
        assertTrue(inner.outputs().isEmpty());
    }

    @Test
    void testLocalsDeclaredInsideAreNotMutations() {
        String source = """
                class Buffers {
                    void fill(List<String> input, Set<String> seen) {
                        int size = input.size();
                        for (String s : input) {
                            List<String> local = new ArrayList<>();
                            local.add(s);
                            seen.add(s);
                        }
                    }
                }
                """;
        VariableFlowAnalysis flow = analyze(source, "fill", 4, 8);

        assertEquals(List.of("input", "seen"), names(flow.inputs()));
        assertEquals(1, flow.mutations().size());
        MutationInfo mutation = flow.mutations().get(0);
        assertEquals("seen", mutation.variable().name());
        assertEquals(7, mutation.line());
        assertEquals(MutationKind.METHOD_CALL, mutation.kind());
    }

    @Test
    void testDirectWritesToOuterVariables() {
        String source = """
                class Totals {
                    int sum(int[] values) {
                        int total = 0;
                        int count = 0;
                        for (int v : values) {
                            total = total + v;
                            count++;
                        }
                        return total / count;
                    }
                }
                """;
        VariableFlowAnalysis flow = analyze(source, "sum", 5, 8);

        assertTrue(names(flow.inputs()).contains("total"));
        List<MutationInfo> mutations = flow.mutations();
        assertEquals(2, mutations.size());
        assertEquals("total", mutations.get(0).variable().name());
        assertEquals(6, mutations.get(0).line());
        assertEquals(MutationKind.ASSIGNMENT, mutations.get(0).kind());
        assertEquals("count", mutations.get(1).variable().name());
        assertEquals(7, mutations.get(1).line());
        assertEquals(MutationKind.INCREMENT, mutations.get(1).kind());
    }

    @Test
    void testMemberWritesThroughAParameter() {
        String source = """
                class Orders {
                    void mark(Order order, boolean paid) {
                        if (paid) {
                            order.status = "PAID";
                            order.attempts++;
                        }
                    }
                }
                """;
        List<MutationInfo> mutations = analyze(source, "mark", 3, 6).mutations();

        assertEquals(2, mutations.size());
        assertEquals(4, mutations.get(0).line());
        assertEquals(MutationKind.ASSIGNMENT, mutations.get(0).kind());
        assertEquals(5, mutations.get(1).line());
        assertEquals(MutationKind.INCREMENT, mutations.get(1).kind());
        assertTrue(mutations.stream().allMatch(m -> m.variable().name().equals("order")));
    }

    @Test
    void testLambdaCapturingReassignedVariable() {
        String source = """
                class Tasks {
                    void schedule(List<Runnable> queue, int base) {
                        int offset = base * 2; offset += base;
                        if (base > 0) {
                            queue.add(() -> System.out.println(offset));
                        }
                    }
                }
                """;
        VariableFlowAnalysis flow = analyze(source, "schedule", 4, 6);

        assertEquals(1, flow.closures().size());
        ClosureInfo closure = flow.closures().get(0);
        assertEquals("offset", closure.variable().name());
        assertEquals(5, closure.startLine());
        assertEquals(List.of("queue"), flow.mutations().stream().map(m -> m.variable().name()).toList());
    }

    @Test
    void testLambdaCapturingEffectivelyFinalLocal_NoClosureIssue() {
        String source = """
                class Tasks {
                    void schedule(List<Runnable> queue, List<String> names) {
                        int offset = names.size();
                        for (String name : names) {
                            queue.add(() -> System.out.println(name + offset));
                        }
                    }
                }
                """;
        VariableFlowAnalysis flow = analyze(source, "schedule", 4, 6);

        assertTrue(flow.closures().isEmpty());
        assertEquals(List.of("queue"), flow.mutations().stream().map(m -> m.variable().name()).toList());
    }

    @Test
    void testIsReassigned() {
        String source = """
                class Totals {
                    int sum(List<Integer> values, int scale) {
                        int total = 0;
                        int factor = scale * 2;
                        for (int value : values) {
                            total += value * factor;
                        }
                        scale = 1;
                        return total;
                    }
                }
                """;
        SyntaxNode root = JavaFixtures.parse(source);
        SyntaxNode sum = JavaFixtures.method(root, "sum");
        Map<String, VariableInfo> variables = new VariableTracker(ScopeAnalyzer.analyze(root)).track(sum);

        assertTrue(VariableFlowAnalyzer.isReassigned(variables.get("total")));
        assertTrue(VariableFlowAnalyzer.isReassigned(variables.get("scale")));
        assertFalse(VariableFlowAnalyzer.isReassigned(variables.get("factor")));
        assertFalse(VariableFlowAnalyzer.isReassigned(variables.get("value")));
        assertFalse(VariableFlowAnalyzer.isReassigned(variables.get("values")));
    }

    @Test
    void testLambdaCapturingConstant_NoClosureIssue() {
        String source = """
                class Tasks {
                    void schedule(List<Runnable> queue, int base) {
                        final int offset = base * 2;
                        if (base > 0) {
                            queue.add(() -> System.out.println(offset));
                        }
                    }
                }
                """;
        assertTrue(analyze(source, "schedule", 4, 6).closures().isEmpty());
    }

    @Test
    void testEarlyReturn() {
        String source = """
                class Lookup {
                    String find(List<String> names, String key) {
                        String found = null;
                        for (String name : names) {
                            if (name.equals(key)) {
                                return name;
                            }
                        }
                        return found;
                    }
                }
                """;
        assertTrue(analyze(source, "find", 4, 8).hasEarlyReturn());
        assertFalse(analyze(source, "find", 4, 7).hasEarlyReturn(), "a return just before the end is not early");
        assertFalse(analyze(source, "find", 3, 3).hasEarlyReturn());
    }

    @Test
    void testSelfReference() {
        String source = """
                class Counter {
                    int count;
                    void add(int v, List<Runnable> hooks) {
                        if (v > 0) {
                            this.count += v;
                        }
                        hooks.add(() -> this.count++);
                        hooks.add(new Runnable() {
                            public void run() {
                                this.toString();
                            }
                        });
                    }
                }
                """;
        assertTrue(analyze(source, "add", 4, 6).hasSelfReference());
        assertTrue(analyze(source, "add", 7, 7).hasSelfReference(), "lambdas share the receiver");
        assertFalse(analyze(source, "add", 8, 12).hasSelfReference(), "anonymous classes have their own");
    }
}
