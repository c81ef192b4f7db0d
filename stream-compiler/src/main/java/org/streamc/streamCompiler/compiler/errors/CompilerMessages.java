package org.streamc.streamCompiler.compiler.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.streamc.util.Utilities;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings produced while compiling one input file. */
public class CompilerMessages {
    public static class Message {
        public final String context;
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(String context, boolean warning, String errorType, String message) {
            this.context = context;
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(String context, JsonProcessingException e) {
            this(context, false, "Error parsing JSON", e.getOriginalMessage());
        }

        Message(String context, IOException e) {
            this(context, false, "Error reading file",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        Message(String context, Throwable e) {
            this(context, false,
                    "This is a bug in the compiler (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        Message(String context, BaseCompilerException e) {
            this(context, false, e.getErrorKind(), e.getMessage());
        }

        public void format(StringBuilder output) {
            if (!this.context.isEmpty())
                output.append(this.context).append(": ");
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("context", this.context);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    public int exitCode = 0;
    /** Usually the name of the file being compiled. */
    public String errorContext;
    public final boolean quiet;
    public final boolean json;

    public CompilerMessages(boolean quiet, boolean json) {
        this.messages = new ArrayList<>();
        this.errorContext = "";
        this.quiet = quiet;
        this.json = json;
    }

    public CompilerMessages() {
        this(false, false);
    }

    public void setErrorContext(String context) {
        this.errorContext = context;
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning) {
            this.setExitCode(1);
        }
    }

    public void reportProblem(boolean warning, String errorType, String message) {
        this.reportError(new Message(this.errorContext, warning, errorType, message));
    }

    public void reportWarning(String message) {
        this.reportProblem(true, "Warning", message);
    }

    public void reportError(JsonProcessingException e) {
        this.reportError(new Message(this.errorContext, e));
    }

    public void reportError(IOException e) {
        this.reportError(new Message(this.errorContext, e));
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(this.errorContext, e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Message(this.errorContext, e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() + (this.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.json) {
            builder.append(this.toJson().toPrettyString());
        } else {
            for (Message message: this.messages) {
                if (this.quiet && message.warning)
                    continue;
                message.format(builder);
            }
        }
        return builder.toString();
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }
}
