package gnf.model.grammar;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static gnf.model.grammar.GrammarBuilder.*;
import static org.junit.Assert.*;

public class SymbolTest {

	@Test
	public void equalityIsStructural() {
		assertEquals(t("a"), t("a"));
		assertEquals(v("A", 1), v("A", 1));
		assertNotEquals(v("A", 1), v("A", 2));
		assertNotEquals(v("A", 1), v("B", 1));
		assertNotEquals(t("A"), v("A", 1));
	}

	@Test
	public void terminalsUseTheSentinelOrderKey() {
		assertEquals(Symbol.NO_ORDER, t("a").getOrderKey());
		assertTrue(t("a").isTerminal());
		assertTrue(v("A", 1).isVariable());
	}

	@Test
	public void orderingPutsTerminalsFirstThenVariablesByKey() {
		List<Symbol> symbols = new ArrayList<>(Arrays.asList(v("B", 2), t("b"), v("A", 3), t("a"), v("C", 1)));
		Collections.sort(symbols);
		assertEquals(Arrays.<Symbol>asList(t("a"), t("b"), v("C", 1), v("B", 2), v("A", 3)), symbols);
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeOrderKeysAreRejected() {
		v("A", -1);
	}

	@Test
	public void bodySplicing() {
		Variable a = v("A", 1);
		Body body = body(a, t("b"), a);
		assertEquals(a, body.first());
		assertTrue(body.startsWith(a));
		assertEquals(body(t("b"), a), body.rest());
		assertEquals(body(t("x"), t("b"), a), body(t("x")).concat(body.rest()));
		assertEquals(body(a, t("b"), a, t("c")), body.append(t("c")));
		assertTrue(body(a).rest().isEmpty());
		assertNull(Body.empty().first());
		assertFalse(Body.empty().startsWith(a));
		assertEquals("A b A", body.toString());
	}
}
