package gnf.trans.passes.validation;

import gnf.errors.Issue;
import gnf.errors.TopLevelIssueContext;
import gnf.model.grammar.Grammar;
import gnf.model.grammar.Variable;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class GnfViolationTest {
	private Grammar grammar;
	private TopLevelIssueContext ctx;
	private Variable x;
	private Variable y;

	@Before
	public void setup() {
		grammar = new Grammar();
		ctx = new TopLevelIssueContext();
		x = v("X", 1);
		y = v("Y", 2);
	}

	@Test
	public void leadingVariableAndDanglingReference() {
		Variable a = v("A", 3);
		rule(grammar, x, body(y, a));
		rule(grammar, y, body(t("b")));
		GnfValidationPass.perform(ctx, grammar);

		List<Issue> issues = ctx.getRootIssues();
		assertThat(issues.size(), is(2));
		GnfViolationIssue violation = (GnfViolationIssue) issues.get(0);
		assertEquals(GnfViolationIssue.Reason.LEADING_VARIABLE, violation.getReason());
		assertEquals(x, violation.getHead());
		assertEquals(body(y, a), violation.getBody());
		assertEquals(a, ((UndefinedVariableIssue) issues.get(1)).getUndefined());
	}

	@Test
	public void oneReportPerBodyForTrailingTerminals() {
		rule(grammar, x, body(t("a"), t("b"), y, t("c")));
		rule(grammar, y, body(t("b")));
		GnfValidationPass.perform(ctx, grammar);

		assertThat(ctx.getRootIssues().size(), is(1));
		assertEquals(GnfViolationIssue.Reason.NON_LEADING_TERMINAL,
				((GnfViolationIssue) ctx.getRootIssues().get(0)).getReason());
	}

	@Test
	public void violationMessage() {
		rule(grammar, x, body(t("a"), t("b")));
		GnfValidationPass.perform(ctx, grammar);
		assertEquals("X -> a b is not in Greibach normal form: a terminal follows the leading symbol",
				ctx.getRootIssues().get(0).getMessage());
	}
}
