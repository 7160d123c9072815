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

public class LeftRecursionEliminationPassTest {
	private Grammar grammar;
	private TopLevelIssueContext ctx;
	private Variable a;

	@Before
	public void setup() {
		grammar = new Grammar();
		ctx = new TopLevelIssueContext();
		a = v("A", 1);
	}

	private Variable eliminate() {
		return LeftRecursionEliminationPass.perform(ctx, grammar, a, new AuxiliaryVariableGenerator(grammar));
	}

	@Test
	public void directLeftRecursion() {
		rule(grammar, a, body(a, t("a")), body(t("b")));
		Variable z = eliminate();

		assertFalse(ctx.hasErrors());
		assertEquals("Z_A_1", z.getName());
		assertEquals(2, z.getOrderKey());
		assertTrue(z.isAuxiliary());
		assertEquals(bodies(body(t("b")), body(t("b"), z)), new ArrayList<>(grammar.getBodies(a)));
		assertEquals(bodies(body(t("a")), body(t("a"), z)), new ArrayList<>(grammar.getBodies(z)));
	}

	@Test
	public void severalRecursiveAndBaseBodies() {
		rule(grammar, a, body(a, t("a")), body(t("c")), body(a, t("b")), body(t("d")));
		Variable z = eliminate();

		assertEquals(
				bodies(body(t("c")), body(t("d")), body(t("c"), z), body(t("d"), z)),
				new ArrayList<>(grammar.getBodies(a)));
		assertEquals(
				bodies(body(t("a")), body(t("b")), body(t("a"), z), body(t("b"), z)),
				new ArrayList<>(grammar.getBodies(z)));
	}

	@Test
	public void noRecursionNoChange() {
		rule(grammar, a, body(t("a"), a), body(t("b")));
		Grammar before = grammar.copy();
		assertNull(eliminate());
		assertEquals(before, grammar);
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void unitCycleIsDropped() {
		rule(grammar, a, body(a), body(t("b")));
		assertNull(eliminate());
		assertFalse(ctx.hasErrors());
		assertEquals(bodies(body(t("b"))), new ArrayList<>(grammar.getBodies(a)));
		assertEquals(1, grammar.size());
	}

	@Test
	public void onlyRecursiveBodies() {
		rule(grammar, a, body(a, t("a")));
		assertNull(eliminate());
		assertThat(ctx.getRootIssues().size(), is(1));
		assertThat(ctx.getRootIssues().get(0), instanceOf(UnreducibleVariableIssue.class));
		assertEquals(a, ((UnreducibleVariableIssue) ctx.getRootIssues().get(0)).getVariable());
	}
}
