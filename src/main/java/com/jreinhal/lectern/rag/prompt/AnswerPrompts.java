package com.jreinhal.lectern.rag.prompt;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.rag.decomposition.SubQuery;
import com.jreinhal.lectern.rag.language.ResponseLanguage;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

/**
 * Message lists for every generation call the pipeline makes.
 */
public final class AnswerPrompts {
    private static final String GROUNDED_SYSTEM = """
            You are a study assistant that answers strictly from the documents the user uploaded.
            Rules:
            - Use only the CONTEXT below. If it does not contain the answer, say that the information is not in the documents.
            - Cite the passages you rely on as [Source N] using the numbers in the context headers.
            - Answer directly. Do not describe your search process.
            """;
    private static final String FULL_DOCUMENT_SYSTEM = """
            You are a study assistant that answers strictly from the documents the user uploaded.
            The complete text of the relevant documents follows, page by page, marked [Page N].
            Rules:
            - Use only this text. If it does not contain the answer, say that the information is not in the documents.
            - Mention page numbers for the facts you use.
            - Answer directly. Do not describe your search process.
            """;
    private static final String SIMPLE_SYSTEM = """
            You are Lectern, an assistant that answers questions about documents the user uploads to a conversation.
            Users upload PDFs or images, then ask questions; you answer from those documents and cite pages.
            Reply briefly and helpfully to the user's message.
            """;
    private static final String SUB_ANSWER_SYSTEM = """
            Answer the question using only the CONTEXT below, in at most five sentences.
            If the context does not contain the answer, reply exactly: NOT FOUND
            """;
    private static final String SYNTHESIS_SYSTEM = """
            You combine partial findings into one answer for a study assistant.
            The user's question was split into parts; each part was answered from the user's documents.
            Write a single coherent answer to the original question using only these findings.
            Where a part could not be answered, say so briefly rather than guessing.
            """;

    private AnswerPrompts() {
    }

    public static List<Message> grounded(String question, String context, List<ChatMessage> history, ResponseLanguage language) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(GROUNDED_SYSTEM + respondIn(language) + "\nCONTEXT:\n" + context));
        messages.addAll(toMessages(history));
        messages.add(new UserMessage(question));
        return messages;
    }

    public static List<Message> fullDocument(String question, String documents, List<ChatMessage> history, ResponseLanguage language) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(FULL_DOCUMENT_SYSTEM + respondIn(language) + "\nDOCUMENTS:\n" + documents));
        messages.addAll(toMessages(history));
        messages.add(new UserMessage(question));
        return messages;
    }

    public static List<Message> simple(String question, List<ChatMessage> history, ResponseLanguage language) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(SIMPLE_SYSTEM + respondIn(language)));
        messages.addAll(toMessages(history));
        messages.add(new UserMessage(question));
        return messages;
    }

    /**
     * The NOT FOUND marker is matched literally and stays in English whatever the
     * answer language.
     */
    public static List<Message> subAnswer(String subQuestion, String context, ResponseLanguage language) {
        return List.of(new SystemMessage(SUB_ANSWER_SYSTEM + respondIn(language) + "\nCONTEXT:\n" + context), new UserMessage(subQuestion));
    }

    public static List<Message> synthesis(String question, List<SubQuery> answered, List<ChatMessage> history, ResponseLanguage language) {
        StringBuilder findings = new StringBuilder();
        for (int i = 0; i < answered.size(); ++i) {
            SubQuery subQuery = answered.get(i);
            findings.append("Part ").append(i + 1).append(": ").append(subQuery.text()).append('\n')
                    .append("Finding: ").append(subQuery.subAnswer()).append("\n\n");
        }
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(SYNTHESIS_SYSTEM + respondIn(language) + "\nFINDINGS:\n" + findings.toString().trim()));
        messages.addAll(toMessages(history));
        messages.add(new UserMessage(question));
        return messages;
    }

    static String respondIn(ResponseLanguage language) {
        ResponseLanguage target = language != null ? language : ResponseLanguage.ENGLISH;
        return "Respond in " + target.displayName() + ".\n";
    }

    public static List<Message> toMessages(List<ChatMessage> history) {
        List<Message> messages = new ArrayList<>();
        if (history == null) {
            return messages;
        }
        for (ChatMessage message : history) {
            if (message.content() == null || message.content().isBlank()) {
                continue;
            }
            messages.add(message.isUser() ? new UserMessage(message.content()) : new AssistantMessage(message.content()));
        }
        return messages;
    }
}
