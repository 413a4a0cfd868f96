package com.arrowlog.logs.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Log body. Only the string form is decoded from columnar batches today. */
public sealed interface LogBody permits LogBody.StringBody {

    static LogBody of(String text) {
        return new StringBody(text);
    }

    @JsonValue
    Object raw();

    record StringBody(String text) implements LogBody {
        public StringBody {
            if (text == null) throw new IllegalArgumentException("text");
        }

        @Override
        public Object raw() {
            return text;
        }
    }
}
