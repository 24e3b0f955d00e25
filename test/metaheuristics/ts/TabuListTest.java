package metaheuristics.ts;

import static org.junit.Assert.*;

import org.junit.Test;

import problems.Move;

/**
 * A test for {@link TabuList}.
 */
public class TabuListTest {

	@Test
	public void evictsOldestAtCapacity() {
		TabuList<Move> tabu = new TabuList<>(3);
		for (int i = 0; i < 10; i++) {
			tabu.push(new Move.Swap(i, i + 1));
			assertTrue(tabu.size() <= tabu.capacity());
		}
		assertEquals(3, tabu.size());
		assertFalse(tabu.contains(new Move.Swap(6, 7)));
		assertTrue(tabu.contains(new Move.Swap(7, 8)));
		assertTrue(tabu.contains(new Move.Swap(9, 10)));
	}

	@Test
	public void membershipIsByValue() {
		TabuList<Move> tabu = new TabuList<>(2);
		tabu.push(new Move.Substitution(1, 2, 3));
		assertTrue(tabu.contains(new Move.Substitution(1, 2, 3)));
		assertFalse(tabu.contains(new Move.Substitution(1, 2, 4)));
		assertFalse(tabu.contains(new Move.Swap(1, 2)));
	}

	@Test
	public void clearEmptiesTheList() {
		TabuList<Move> tabu = new TabuList<>(2);
		tabu.push(new Move.Swap(0, 1));
		tabu.clear();
		assertEquals(0, tabu.size());
		assertFalse(tabu.contains(new Move.Swap(0, 1)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsZeroCapacity() {
		new TabuList<Move>(0);
	}
}
