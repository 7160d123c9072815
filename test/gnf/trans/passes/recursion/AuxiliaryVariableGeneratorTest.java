package gnf.trans.passes.recursion;

import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class AuxiliaryVariableGeneratorTest {
	private Grammar grammar;
	private TopLevelIssueContext ctx;
	private Variable a;
	private Variable b;

	@Before
	public void setup() {
		grammar = new Grammar();
		ctx = new TopLevelIssueContext();
		a = v("A", 1);
		b = v("B", 2);
		rule(grammar, a, body(b, t("+")));
		rule(grammar, b, body(t("b")));
	}

	@Test
	public void oneCounterForAllNames() {
		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);
		Variable za = generator.recursionVariable(ctx, a);
		Variable zb = generator.recursionVariable(ctx, b);
		Variable plus = generator.terminalVariable(ctx, t("+"));

		assertEquals("Z_A_1", za.getName());
		assertEquals("Z_B_2", zb.getName());
		assertEquals("X_+_3", plus.getName());
		assertEquals(3, za.getOrderKey());
		assertEquals(4, zb.getOrderKey());
		assertEquals(5, plus.getOrderKey());
		assertEquals(order(za, zb, plus), generator.getCreatedVariables());
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void createdVariablesAreDeclared() {
		Variable z = new AuxiliaryVariableGenerator(grammar).recursionVariable(ctx, a);
		assertTrue(grammar.hasVariable(z));
		assertTrue(grammar.getBodies(z).isEmpty());
		assertEquals(1, grammar.getAuxiliaryVariables().size());
	}

	@Test
	public void orderKeysStayAboveUndeclaredReferences() {
		grammar.insert(b, body(t("b"), v("U", 10)));
		Variable z = new AuxiliaryVariableGenerator(grammar).recursionVariable(ctx, a);
		assertEquals(11, z.getOrderKey());
	}

	@Test
	public void takenNamesAreSkipped() {
		Variable taken = v("Z_A_1", 3);
		rule(grammar, taken, body(t("c")));
		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);

		Variable za = generator.recursionVariable(ctx, a);
		Variable zb = generator.recursionVariable(ctx, b);
		assertFalse(ctx.hasErrors());
		assertEquals("Z_A_2", za.getName());
		assertEquals(4, za.getOrderKey());
		assertEquals("Z_B_3", zb.getName());
		assertEquals(bodies(body(t("c"))), new ArrayList<>(grammar.getBodies(taken)));
	}

	@Test
	public void takenTerminalNamesAreSkipped() {
		rule(grammar, v("X_+_1", 3), body(t("p")));
		Variable plus = new AuxiliaryVariableGenerator(grammar).terminalVariable(ctx, t("+"));
		assertEquals("X_+_2", plus.getName());
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void runningOutOfOrderKeys() {
		Variable last = v("L", Integer.MAX_VALUE);
		rule(grammar, last, body(t("l")));
		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);

		assertNull(generator.recursionVariable(ctx, a));
		assertThat(ctx.getRootIssues().size(), is(1));
		OrderKeyOverflowIssue issue = (OrderKeyOverflowIssue) ctx.getRootIssues().get(0);
		assertEquals("Z_A_1", issue.getCandidateName());
		assertEquals(Integer.MAX_VALUE, issue.getLargestOrderKey());
		assertTrue(generator.getCreatedVariables().isEmpty());
		assertEquals(3, grammar.size());
	}
}
