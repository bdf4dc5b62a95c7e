package it.floro.soilstats.engine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Combinatori su sequenze single-pass.
 */
public final class Sequences {

    private Sequences() {}

    /**
     * Appiattisce una sequenza di sequenze in un'unica sequenza lazy.
     * Le sequenze interne vengono richieste una alla volta, solo quando la
     * precedente è esaurita; il risultato non è riavviabile.
     */
    public static <T> Flattened<T> flatten(Iterator<? extends Iterator<? extends T>> sequences) {
        return new Flattened<>(sequences);
    }

    /**
     * Iteratore appiattito. {@link #close()} chiude la sequenza interna corrente
     * se è {@link AutoCloseable}, così un consumo interrotto non lascia handle aperti.
     */
    public static final class Flattened<T> implements Iterator<T>, AutoCloseable {

        private final Iterator<? extends Iterator<? extends T>> outer;
        private Iterator<? extends T> current;

        private Flattened(Iterator<? extends Iterator<? extends T>> outer) {
            this.outer = outer;
        }

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (!outer.hasNext()) {
                    current = null;
                    return false;
                }
                current = outer.next();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        @Override
        public void close() {
            if (current instanceof AutoCloseable closeable) {
                current = null;
                try {
                    closeable.close();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Chiusura della sequenza interna fallita", e);
                }
            }
        }
    }
}
