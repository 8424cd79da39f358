package com.bdfrenumber.core.bulk;

import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a deck, includes flattened, into a {@link BulkModel}.
 *
 * <p>The model keeps no record of which file a card came from; the include
 * scanner recovers that independently.
 */
public interface ModelRepository {

    /**
     * Reads a deck and every file it includes.
     *
     * @param root root deck file
     * @param disabledCards card names to keep as passthrough
     * @return flattened model
     * @throws com.bdfrenumber.core.RenumberException if a file is unreadable; missing includes are skipped
     */
    BulkModel read(Path root, Set<String> disabledCards);
}
