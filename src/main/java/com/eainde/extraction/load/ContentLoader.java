package com.eainde.extraction.load;

import com.eainde.extraction.exception.ContentLoadException;

/**
 * Supplies the already-rendered plain text of a document.
 */
public interface ContentLoader {

    /**
     * @param source location of the document
     * @return the document text, possibly truncated
     * @throws ContentLoadException if nothing could be read
     */
    String load(String source);
}
