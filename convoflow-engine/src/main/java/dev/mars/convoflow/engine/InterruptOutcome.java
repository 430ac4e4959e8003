/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.convoflow.engine;

/**
 * What an intent interruption did to the current turn.
 */
final class InterruptOutcome {

    enum Kind {
        CANCEL,
        HELP,
        FLOW_SWITCH
    }

    private final Kind kind;
    private final String intent;
    private final String target;

    private InterruptOutcome(Kind kind, String intent, String target) {
        this.kind = kind;
        this.intent = intent;
        this.target = target;
    }

    static InterruptOutcome cancel(String intent, String target) {
        return new InterruptOutcome(Kind.CANCEL, intent, target);
    }

    static InterruptOutcome help(String intent) {
        return new InterruptOutcome(Kind.HELP, intent, null);
    }

    static InterruptOutcome flowSwitch(String intent) {
        return new InterruptOutcome(Kind.FLOW_SWITCH, intent, null);
    }

    Kind getKind() {
        return kind;
    }

    String getIntent() {
        return intent;
    }

    /**
     * Cancel target state, or {@code null} when the flow declares none.
     */
    String getTarget() {
        return target;
    }

    boolean isCancel() {
        return kind == Kind.CANCEL;
    }
}
