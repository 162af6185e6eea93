package com.jreinhal.lectern.service;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.rag.fallback.PipelineRun;
import com.jreinhal.lectern.rag.language.ResponseLanguage;
import com.jreinhal.lectern.vector.PartitionHandle;
import java.util.List;
import java.util.Map;

/**
 * Everything a strategy needs about the request it is answering.
 *
 * @param language language the answer is written in
 * @param filter  metadata filter applied to every search (mentioned files), possibly empty
 * @param fileIds files in scope for full-document reading
 */
record QueryScope(String query, ResponseLanguage language, PartitionHandle partition, Map<String, Object> filter, List<String> fileIds,
        List<ChatMessage> history, PipelineRun run) {
}
