package gnf.trans.passes.validation;

import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Body;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import gnf.trans.passes.recursion.UnreducibleVariableIssue;
import org.junit.Before;
import org.junit.Test;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class GrammarValidationPassTest {
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
	public void wellFormed() {
		rule(grammar, s, body(s, t("a")), body(t("b")));
		GrammarValidationPass.perform(ctx, grammar);
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void emptyBody() {
		rule(grammar, s, body(t("a")), Body.empty());
		GrammarValidationPass.perform(ctx, grammar);

		assertThat(ctx.getRootIssues().size(), is(1));
		EmptyBodyIssue issue = (EmptyBodyIssue) ctx.getRootIssues().get(0);
		assertEquals(s, issue.getHead());
		assertTrue(issue.getBody().isEmpty());
		assertEquals(
				"malformed grammar: S -> ε has an empty body; epsilon productions must be removed before conversion",
				issue.getMessage());
	}

	@Test
	public void declaredWithoutProductions() {
		grammar.declare(s);
		GrammarValidationPass.perform(ctx, grammar);

		assertThat(ctx.getRootIssues().size(), is(1));
		assertThat(ctx.getRootIssues().get(0), instanceOf(UnreducibleVariableIssue.class));
	}
}
