package metaheuristics.ts;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of recently applied moves. Pushing onto a full list evicts the
 * oldest move; membership is tested with {@link Object#equals}.
 */
public class TabuList<M> {

	private final int capacity;
	private final Deque<M> moves;

	public TabuList(int capacity) {
		if (capacity < 1) throw new IllegalArgumentException("Tabu list capacity must be >= 1, got " + capacity);
		this.capacity = capacity;
		this.moves = new ArrayDeque<>(capacity);
	}

	public boolean contains(M move) {
		return moves.contains(move);
	}

	public void push(M move) {
		if (moves.size() == capacity) moves.removeFirst();
		moves.addLast(move);
	}

	public void clear() {
		moves.clear();
	}

	public int size() {
		return moves.size();
	}

	public int capacity() {
		return capacity;
	}

	@Override
	public String toString() {
		return "TabuList" + moves;
	}
}
