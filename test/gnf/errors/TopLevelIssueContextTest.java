package gnf.errors;

import gnf.model.grammar.Variable;
import gnf.trans.WhileRewritingVariable;
import gnf.trans.passes.recursion.UnreducibleVariableIssue;
import org.junit.Test;

import java.util.Collections;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TopLevelIssueContextTest {

	@Test
	public void nestedContextWrapsIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Variable a = v("A", 1);
		IssueContext nested = ctx.withContext(
				new WhileRewritingVariable(a, WhileRewritingVariable.Phase.LEFT_RECURSION_ELIMINATION));
		assertFalse(nested.hasErrors());
		UnreducibleVariableIssue issue = new UnreducibleVariableIssue(a);
		nested.error(issue);

		assertTrue(ctx.hasErrors());
		assertTrue(nested.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(IssueWithContext.class));
		assertEquals(Collections.<Issue>singletonList(issue), ctx.getRootIssues());
	}

	@Test
	public void formatIndentsIssuesUnderTheirContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Variable a = v("A", 1);
		ctx.withContext(new WhileRewritingVariable(a, WhileRewritingVariable.Phase.LEFT_RECURSION_ELIMINATION))
				.error(new UnreducibleVariableIssue(a));
		assertEquals(
				String.join(System.lineSeparator(),
						"Detected 1 issue(s):",
						"while rewriting A during left-recursion elimination",
						"    variable A derives no terminal string"),
				ctx.format());
	}

	@Test
	public void issueMessagesAreFormatted() {
		assertEquals("variable B derives no terminal string", new UnreducibleVariableIssue(v("B", 2)).getMessage());
	}
}
