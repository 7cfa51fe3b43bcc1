package software.amazon.fsa;

import javax.annotation.concurrent.Immutable;

/**
 * A partially built piece of an automaton, identified by its entry and exit states. Fragments are not stored in the
 * automaton; they are handed from one composition step to the next. The exit state carries no special marking in the
 * graph; it is simply the state the caller intends to extend or to make accepting.
 */
@Immutable
public final class Fragment {

    private final int entry;
    private final int exit;

    public Fragment(final int entry, final int exit) {
        this.entry = entry;
        this.exit = exit;
    }

    public int getEntry() {
        return entry;
    }

    public int getExit() {
        return exit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        Fragment fragment = (Fragment) o;
        return entry == fragment.entry && exit == fragment.exit;
    }

    @Override
    public int hashCode() {
        return 31 * entry + exit;
    }

    @Override
    public String toString() {
        return "(" + entry + "->" + exit + ")";
    }
}
