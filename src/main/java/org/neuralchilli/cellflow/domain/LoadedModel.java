package org.neuralchilli.cellflow.domain;

import java.nio.file.Path;

/**
 * An in-memory model loaded once and shared by every task of one channel.
 * Its identity is neither stable across runs nor serializable, so it never
 * contributes to a cache key.
 */
public interface LoadedModel {

    /**
     * Location the model was loaded from.
     */
    Path source();
}
