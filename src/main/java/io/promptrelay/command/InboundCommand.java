package io.promptrelay.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Typed requests accepted from remote automation. The JSON form carries a {@code type}
 * discriminator, e.g. {@code {"type":"execute_prompt","document":"Plan","promptNumber":2}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InboundCommand.ExecutePrompt.class, name = "execute_prompt"),
        @JsonSubTypes.Type(value = InboundCommand.ExecutePromptSequence.class, name = "execute_prompt_sequence"),
        @JsonSubTypes.Type(value = InboundCommand.GetDocumentInfo.class, name = "get_document_info"),
        @JsonSubTypes.Type(value = InboundCommand.GetExecutionStatus.class, name = "get_execution_status"),
        @JsonSubTypes.Type(value = InboundCommand.CancelExecution.class, name = "cancel_execution"),
        @JsonSubTypes.Type(value = InboundCommand.ListDocuments.class, name = "list_documents"),
        @JsonSubTypes.Type(value = InboundCommand.ProcessDocument.class, name = "process_document")
})
public interface InboundCommand {
    record ExecutePrompt(String document, Integer promptNumber) implements InboundCommand {
    }

    record ExecutePromptSequence(String document, List<Integer> promptNumbers, Boolean stopOnError)
            implements InboundCommand {
        public boolean stopOnErrorOrDefault() {
            return stopOnError == null || stopOnError;
        }
    }

    record GetDocumentInfo(String document) implements InboundCommand {
    }

    record GetExecutionStatus(String executionId) implements InboundCommand {
    }

    record CancelExecution(String executionId) implements InboundCommand {
    }

    record ListDocuments() implements InboundCommand {
    }

    record ProcessDocument(String documentPath) implements InboundCommand {
    }
}
