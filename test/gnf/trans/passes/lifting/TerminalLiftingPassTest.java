package gnf.trans.passes.lifting;

import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import gnf.trans.passes.recursion.AuxiliaryVariableGenerator;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.junit.Assert.*;

public class TerminalLiftingPassTest {
	private Grammar grammar;
	private TopLevelIssueContext ctx;
	private Variable s;

	@Before
	public void setup() {
		grammar = new Grammar();
		ctx = new TopLevelIssueContext();
		s = v("S", 1);
	}

	@Test
	public void trailingTerminalsBecomeVariables() {
		rule(grammar, s, body(t("a"), s, t("b")), body(t("b"), t("b")), body(t("c")));
		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);
		TerminalLiftingPass.perform(ctx, grammar, generator);

		assertFalse(ctx.hasErrors());
		assertEquals(1, generator.getCreatedVariables().size());
		Variable x = generator.getCreatedVariables().get(0);
		assertEquals("X_b_1", x.getName());
		assertEquals(2, x.getOrderKey());
		assertEquals(
				bodies(body(t("a"), s, x), body(t("b"), x), body(t("c"))),
				new ArrayList<>(grammar.getBodies(s)));
		assertEquals(bodies(body(t("b"))), new ArrayList<>(grammar.getBodies(x)));
	}

	@Test
	public void leadingTerminalsStay() {
		rule(grammar, s, body(t("a"), s), body(t("b")));
		Grammar before = grammar.copy();
		AuxiliaryVariableGenerator generator = new AuxiliaryVariableGenerator(grammar);
		TerminalLiftingPass.perform(ctx, grammar, generator);

		assertEquals(before, grammar);
		assertTrue(generator.getCreatedVariables().isEmpty());
	}
}
