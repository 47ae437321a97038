/**
 * Retrieval of prompt context: the retriever port, its embedding-based implementation and
 * the embedding and vector index ports it composes.
 */
package com.phillippitts.talkback.service.rag;
