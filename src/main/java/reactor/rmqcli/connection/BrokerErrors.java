/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.rmqcli.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import reactor.util.annotation.Nullable;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Turns client library exceptions into one-line messages for the user.
 */
public final class BrokerErrors {

    public static final int NOT_FOUND = AMQP.NOT_FOUND;

    public static final int ACCESS_REFUSED = AMQP.ACCESS_REFUSED;

    private BrokerErrors() {
    }

    /**
     * Describes the most specific cause found in the cause chain of {@code error}.
     */
    public static String describe(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException) {
                String replyText = replyText((ShutdownSignalException) t);
                if (replyText != null)
                    return replyText;
            }
            if (t instanceof AuthenticationFailureException)
                return "Authentication failed, check user and password";
            if (t instanceof ConnectException)
                return "Connection refused";
            if (t instanceof UnknownHostException)
                return "Unknown host " + t.getMessage();
            if (t instanceof TimeoutException)
                return "Timed out waiting for the broker";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Returns the AMQP reply code of the channel or connection close found in the cause
     * chain, -1 if there is none.
     */
    public static int replyCode(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException) {
                Method reason = ((ShutdownSignalException) t).getReason();
                if (reason instanceof AMQP.Channel.Close)
                    return ((AMQP.Channel.Close) reason).getReplyCode();
                if (reason instanceof AMQP.Connection.Close)
                    return ((AMQP.Connection.Close) reason).getReplyCode();
            }
        }
        return -1;
    }

    @Nullable
    private static String replyText(ShutdownSignalException sse) {
        Method reason = sse.getReason();
        if (reason instanceof AMQP.Channel.Close)
            return ((AMQP.Channel.Close) reason).getReplyText();
        if (reason instanceof AMQP.Connection.Close)
            return ((AMQP.Connection.Close) reason).getReplyText();
        return null;
    }
}
