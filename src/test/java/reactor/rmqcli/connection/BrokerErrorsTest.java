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
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.assertEquals;

public class BrokerErrorsTest {

    private static ShutdownSignalException channelClose(int code, String text) {
        AMQP.Channel.Close close = new AMQP.Channel.Close.Builder().replyCode(code).replyText(text).build();
        return new ShutdownSignalException(false, false, close, null);
    }

    @Test
    public void replyCodeIsFoundInCauseChain() {
        IOException error = new IOException(channelClose(404, "NOT_FOUND - no queue 'q'"));

        assertEquals(BrokerErrors.NOT_FOUND, BrokerErrors.replyCode(error));
        assertEquals("NOT_FOUND - no queue 'q'", BrokerErrors.describe(error));
    }

    @Test
    public void connectionCloseIsDescribed() {
        AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
            .replyCode(320)
            .replyText("CONNECTION_FORCED - broker forced connection closure")
            .build();
        ShutdownSignalException error = new ShutdownSignalException(true, false, close, null);

        assertEquals(320, BrokerErrors.replyCode(error));
        assertEquals("CONNECTION_FORCED - broker forced connection closure", BrokerErrors.describe(error));
    }

    @Test
    public void clientSideFailures() {
        assertEquals("Connection refused",
            BrokerErrors.describe(new IOException(new ConnectException("Connection refused (Connection refused)"))));
        assertEquals("Authentication failed, check user and password",
            BrokerErrors.describe(new AuthenticationFailureException("ACCESS_REFUSED")));
        assertEquals("Timed out waiting for the broker", BrokerErrors.describe(new TimeoutException()));
        assertEquals(-1, BrokerErrors.replyCode(new IOException("plain")));
    }

    @Test
    public void fallsBackToMessageOrType() {
        assertEquals("plain", BrokerErrors.describe(new IOException("plain")));
        assertEquals("IOException", BrokerErrors.describe(new IOException()));
    }
}
