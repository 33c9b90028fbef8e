package com.actexport.core.render;

/**
 * Sink that accumulates one output document.
 *
 * @param <T> output type
 */
public interface DocumentSink<T> extends ActNodeSink {

    /**
     * Emits the document title. Called once, before the walk, for full renders only.
     *
     * @param title title text
     */
    void onTitle(String title);

    /**
     * Completes the document.
     *
     * @return rendered output
     */
    T finish();
}
