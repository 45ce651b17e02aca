package com.deepagent.core.hitl;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reviewer's answer to one {@link ActionRequest}.
 */
public sealed interface Decision extends Serializable permits Decision.Approve, Decision.Reject, Decision.Edit {

    DecisionType type();

    /** Run the call with the arguments the model proposed. */
    record Approve() implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.APPROVE;
        }
    }

    /** Skip the call; {@code message} is passed back to the model when present. */
    record Reject(String message) implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.REJECT;
        }
    }

    /** Run the call with replacement arguments. */
    record Edit(Map<String, Object> editedArguments) implements Decision {
        public Edit {
            editedArguments = editedArguments == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(editedArguments));
        }

        @Override
        public DecisionType type() {
            return DecisionType.EDIT;
        }
    }

    static Decision approve() {
        return new Approve();
    }

    static Decision reject(String message) {
        return new Reject(message);
    }

    static Decision edit(Map<String, Object> editedArguments) {
        return new Edit(editedArguments);
    }
}
