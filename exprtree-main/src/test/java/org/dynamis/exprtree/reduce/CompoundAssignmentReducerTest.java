package org.dynamis.exprtree.reduce;

import org.dynamis.exprtree.TreeSettings;
import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.BlockNode;
import org.dynamis.exprtree.expressions.CallNode;
import org.dynamis.exprtree.expressions.IndexNode;
import org.dynamis.exprtree.expressions.MemberNode;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeFactory;
import org.dynamis.exprtree.expressions.NodeType;
import org.dynamis.exprtree.expressions.NodeVisitor;
import org.dynamis.exprtree.expressions.VariableNode;
import org.dynamis.exprtree.resolve.OperatorResolver;
import org.dynamis.exprtree.test.OperatorFixtures.Account;
import org.dynamis.exprtree.test.OperatorFixtures.Amount;
import org.dynamis.exprtree.test.OperatorFixtures.Bank;
import org.dynamis.exprtree.test.OperatorFixtures.Counter;
import org.dynamis.exprtree.test.OperatorFixtures.Counters;
import org.dynamis.exprtree.test.OperatorFixtures.Cursor;
import org.dynamis.exprtree.test.OperatorFixtures.Recorder;
import org.dynamis.exprtree.test.OperatorFixtures.Sheet;
import org.dynamis.exprtree.test.TreeInterpreter;
import org.dynamis.exprtree.types.OperatorMethod;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompoundAssignmentReducerTest {

    private final NodeFactory factory = NodeFactory.create();
    private final CompoundAssignmentReducer reducer = new CompoundAssignmentReducer(factory, TreeSettings.defaults());

    @Test
    void variableTarget_becomesAssignmentOfOperation() {
        VariableNode x = factory.variable(int.class, "x");
        BinaryNode node = factory.addAssign(x, factory.constant(1));

        Node reduced = reducer.reduce(node);

        assertThat(reduced).isInstanceOf(BinaryNode.class);
        BinaryNode assign = (BinaryNode) reduced;
        assertThat(assign.getKind()).isEqualTo(BinaryOperatorKind.ASSIGN);
        assertThat(assign.getLeft()).isSameAs(x);
        BinaryNode add = (BinaryNode) assign.getRight();
        assertThat(add.getKind()).isEqualTo(BinaryOperatorKind.ADD);
        assertThat(add.getLeft()).isSameAs(x);

        TreeInterpreter interpreter = new TreeInterpreter().set(x, 41);
        assertThat(interpreter.evaluate(reduced)).isEqualTo(42);
        assertThat(interpreter.get(x)).isEqualTo(42);
    }

    @Test
    void nonCompoundNode_returnedUnchanged() {
        BinaryNode node = factory.add(factory.variable(int.class, "x"), factory.constant(1));
        assertThat(reducer.reduce(node)).isSameAs(node);
    }

    @Test
    void inputNodeIsNotModified() {
        VariableNode x = factory.variable(int.class, "x");
        BinaryNode node = factory.subtractAssign(x, factory.constant(1));
        reducer.reduce(node);
        assertThat(node.getKind()).isEqualTo(BinaryOperatorKind.SUBTRACT_ASSIGN);
        assertThat(node.getLeft()).isSameAs(x);
        assertThat(node.canReduce()).isTrue();
    }

    @Test
    void memberTarget_evaluatesReceiverOnce() throws Exception {
        Account account = new Account(10);
        Bank bank = new Bank(account);
        CallNode receiver = factory.call(factory.constant(bank), Bank.class.getMethod("account"));
        MemberNode balance = factory.property(receiver, "balance");
        BinaryNode node = factory.addAssign(balance, factory.constant(5));

        Node reduced = reducer.reduce(node);

        assertThat(reduced.getNodeType()).isEqualTo(NodeType.BLOCK);
        BlockNode block = (BlockNode) reduced;
        assertThat(block.getVariables()).hasSize(2);
        assertThat(block.getVariables()).extracting(VariableNode::getName).containsExactly("$receiver0", "$value1");
        assertThat(block.getResult()).isSameAs(block.getVariables().get(1));

        Object result = new TreeInterpreter().evaluate(reduced);

        assertThat(result).isEqualTo(15);
        assertThat(bank.lookups).isEqualTo(1);
        assertThat(account.reads).isEqualTo(1);
        assertThat(account.writes).isEqualTo(1);
        assertThat(account.getBalance()).isEqualTo(15);
    }

    @Test
    void staticMemberTarget_needsNoTemporaries() {
        MemberNode total = factory.field(Counter.class, "total");
        Node reduced = reducer.reduce(factory.addAssign(total, factory.constant(7)));

        assertThat(reduced.getNodeType()).isEqualTo(NodeType.BINARY);
        assertThat(((BinaryNode) reduced).getKind()).isEqualTo(BinaryOperatorKind.ASSIGN);

        Counter.total = 3;
        assertThat(new TreeInterpreter().evaluate(reduced)).isEqualTo(10);
        assertThat(Counter.total).isEqualTo(10);
    }

    @Test
    void indexerTarget_evaluatesInSourceOrder() throws Exception {
        Recorder recorder = new Recorder(1, new Amount(3));
        List<String> events = recorder.events;
        Counters counters = new Counters(events, new Amount(1), new Amount(2));
        OperatorMethod multiply = OperatorMethod.declared(Amount.class, "multiply")
            .parameter(Amount.class)
            .parameter(Amount.class)
            .returns(Amount.class)
            .invoker(arguments -> {
                events.add("multiply");
                return Amount.multiply((Amount) arguments[0], (Amount) arguments[1]);
            })
            .build();

        IndexNode target = factory.index(factory.constant(counters),
                                         factory.call(factory.constant(recorder), Recorder.class.getMethod("f")));
        CallNode value = factory.call(factory.constant(recorder), Recorder.class.getMethod("g"));
        BinaryNode node = factory.multiplyAssign(target, value, multiply);
        assertThat(node.getType()).isEqualTo(Amount.class);

        Node reduced = reducer.reduce(node);

        BlockNode block = (BlockNode) reduced;
        assertThat(block.getVariables()).extracting(VariableNode::getName)
            .containsExactly("$object0", "$arg1", "$value2");
        BinaryNode writeBack = (BinaryNode) block.getResult();
        assertThat(writeBack.getKind()).isEqualTo(BinaryOperatorKind.ASSIGN);
        assertThat(writeBack.getLeft().getNodeType()).isEqualTo(NodeType.INDEX);

        Object result = new TreeInterpreter().evaluate(reduced);

        assertThat(result).isEqualTo(new Amount(6));
        assertThat(events).containsExactly("f", "get", "g", "multiply", "set");
        assertThat(counters.get(1)).isEqualTo(new Amount(6));
    }

    @Test
    void indexerWithTwoArguments_cachesEveryArgument() throws Exception {
        List<String> events = new ArrayList<>();
        int[][] cells = {{1, 2}, {10, 20}};
        Cursor cursor = new Cursor(events, new Sheet(events, cells));
        Node source = factory.constant(cursor);

        IndexNode target = factory.index(factory.call(source, Cursor.class.getMethod("sheet")),
                                         factory.call(source, Cursor.class.getMethod("row")),
                                         factory.call(source, Cursor.class.getMethod("column")));
        Node reduced = reducer.reduce(factory.addAssign(target, factory.call(source, Cursor.class.getMethod("amount"))));

        BlockNode block = (BlockNode) reduced;
        assertThat(block.getVariables()).extracting(VariableNode::getName)
            .containsExactly("$object0", "$arg1", "$arg2", "$value3");
        assertThat(block.getVariables()).extracting(VariableNode::getType)
            .containsExactly(Sheet.class, int.class, int.class, int.class);

        Object result = new TreeInterpreter().evaluate(reduced);

        assertThat(result).isEqualTo(13);
        assertThat(events).containsExactly("sheet", "row", "column", "get10", "amount", "set10");
        assertThat(cells[1]).containsExactly(13, 20);
        assertThat(cells[0]).containsExactly(1, 2);
    }

    @Test
    void arrayTarget_writesBackThroughTemporaries() {
        int[] values = {1, 2, 3};
        VariableNode array = factory.variable(int[].class, "values");
        IndexNode element = factory.arrayAccess(array, factory.constant(1));
        Node reduced = reducer.reduce(factory.multiplyAssign(element, factory.constant(10)));

        assertThat(((BlockNode) reduced).getVariables()).hasSize(3);
        Object result = new TreeInterpreter().set(array, values).evaluate(reduced);

        assertThat(result).isEqualTo(20);
        assertThat(values).containsExactly(1, 20, 3);
    }

    @Test
    void powerAssign_keepsDefaultMethod() {
        VariableNode x = factory.variable(double.class, "x");
        Node reduced = reducer.reduce(factory.powerAssign(x, factory.constant(2.0)));

        BinaryNode power = (BinaryNode) ((BinaryNode) reduced).getRight();
        assertThat(power.getKind()).isEqualTo(BinaryOperatorKind.POWER);
        assertThat(power.getMethod()).isEqualTo(OperatorResolver.POWER_METHOD);
        assertThat(new TreeInterpreter().set(x, 3.0).evaluate(reduced)).isEqualTo(9.0);
    }

    @Test
    void checkedCompound_reducesToCheckedOperation() {
        VariableNode x = factory.variable(int.class, "x");
        Node reduced = reducer.reduce(factory.addAssignChecked(x, factory.constant(1)));

        assertThat(((BinaryNode) ((BinaryNode) reduced).getRight()).getKind()).isEqualTo(BinaryOperatorKind.ADD_CHECKED);
        TreeInterpreter interpreter = new TreeInterpreter().set(x, Integer.MAX_VALUE);
        assertThatThrownBy(() -> interpreter.evaluate(reduced)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void unsupportedTarget_rejected() {
        Node writable = new Node() {
            @Override
            public Class<?> getType() {
                return int.class;
            }

            @Override
            public NodeType getNodeType() {
                return NodeType.CONSTANT;
            }

            @Override
            public boolean canWrite() {
                return true;
            }

            @Override
            public <R> R accept(NodeVisitor<R> visitor) {
                throw new UnsupportedOperationException();
            }
        };
        BinaryNode node = factory.addAssign(writable, factory.constant(1));
        assertThatThrownBy(() -> reducer.reduce(node))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("CONSTANT");
    }

    @Test
    void tempNames_followConfiguredPrefix() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(TreeSettings.TEMP_PREFIX, "_t");
        CompoundAssignmentReducer prefixed = new CompoundAssignmentReducer(factory, TreeSettings.from(properties));

        Bank bank = new Bank(new Account(0));
        CallNode receiver = factory.call(factory.constant(bank), Bank.class.getMethod("account"));
        BlockNode block = (BlockNode) prefixed.reduce(factory.addAssign(factory.property(receiver, "balance"), factory.constant(1)));

        assertThat(block.getVariables()).extracting(VariableNode::getName).containsExactly("_treceiver0", "_tvalue1");
    }

    @Test
    void customAllocator_calledOncePerReduction() throws Exception {
        List<String> roles = new ArrayList<>();
        CompoundAssignmentReducer custom = new CompoundAssignmentReducer(factory, () -> role -> {
            roles.add(role);
            return "tmp_" + role + roles.size();
        });
        Bank bank = new Bank(new Account(0));
        CallNode receiver = factory.call(factory.constant(bank), Bank.class.getMethod("account"));
        MemberNode balance = factory.property(receiver, "balance");

        custom.reduce(factory.addAssign(balance, factory.constant(1)));
        custom.reduce(factory.addAssign(balance, factory.constant(2)));

        assertThat(roles).containsExactly("receiver", "value", "receiver", "value");
    }

    @Test
    void sequentialAllocator_countsAcrossRoles() {
        SequentialTempNameAllocator names = new SequentialTempNameAllocator("$");
        assertThat(names.allocate("object")).isEqualTo("$object0");
        assertThat(names.allocate("arg")).isEqualTo("$arg1");
        assertThat(names.allocate("arg")).isEqualTo("$arg2");
    }
}
