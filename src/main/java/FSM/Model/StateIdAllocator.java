package FSM.Model;

/**
 * Hands out fresh state identifiers for one construction call.
 * A new allocator is created per top-level operation and passed down to every sub-construction,
 * so identifiers are unique within the produced automaton and independent runs never interfere.
 */
public class StateIdAllocator {
    private final String prefix;
    private int next;

    public StateIdAllocator(String prefix) {
        this(prefix, 0);
    }

    public StateIdAllocator(String prefix, int first) {
        this.prefix = prefix;
        this.next = first;
    }

    /**
     * @return a state identifier that was never returned before by this allocator
     */
    public String next() {
        return prefix + next++;
    }

    /**
     * @return the counter value of the next identifier
     */
    public int allocated() {
        return next;
    }

    @Override
    public String toString() {
        return prefix + "*" + next;
    }
}
