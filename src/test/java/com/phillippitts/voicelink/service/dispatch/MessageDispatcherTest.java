package com.phillippitts.voicelink.service.dispatch;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.domain.InboundMessage;
import com.phillippitts.voicelink.exception.MessageDispatchException;
import com.phillippitts.voicelink.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MessageDispatcherTest {

    private static final Instant CONNECTED = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private MessageDispatcher dispatcher;
    private MessageEnvelopeDecoder decoder;
    private ConnectionSnapshot connection;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CONNECTED);
        dispatcher = new MessageDispatcher(clock);
        decoder = new MessageEnvelopeDecoder();
        connection = new ConnectionSnapshot("conn_1", CONNECTED, CONNECTED, 3);
        clock.advance(Duration.ofMillis(2_500));
    }

    private JSONObject dispatch(String raw) {
        return dispatcher.dispatch(decoder.decode(raw), connection);
    }

    @Test
    void pingEchoesOriginalTimestamp() {
        JSONObject pong = dispatch("{\"type\":\"ping\",\"timestamp\":1700000000123}");

        assertThat(pong.getString("type")).isEqualTo("pong");
        assertThat(pong.getLong("original_timestamp")).isEqualTo(1700000000123L);
        assertThat(pong.getLong("timestamp")).isEqualTo(CONNECTED.getEpochSecond() + 2);
        assertThat(pong.getDouble("server_connection_time")).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void pingWithoutTimestampEchoesNull() {
        JSONObject pong = dispatch("{\"type\":\"ping\"}");

        assertThat(pong.has("original_timestamp")).isTrue();
        assertThat(pong.isNull("original_timestamp")).isTrue();
    }

    @Test
    void pingEchoesNonNumericTimestampUnchanged() {
        JSONObject pong = dispatch("{\"type\":\"ping\",\"timestamp\":\"t-1\"}");

        assertThat(pong.get("original_timestamp")).isEqualTo("t-1");
    }

    @Test
    void testMessageEchoesDataAndReportsStats() {
        JSONObject response = dispatch("{\"type\":\"test\",\"data\":\"abc\"}");

        assertThat(response.getString("type")).isEqualTo("test_response");
        assertThat(response.getString("message")).isNotBlank();
        assertThat(response.getString("echo_data")).isEqualTo("abc");
        assertThat(response.getLong("server_time")).isEqualTo(CONNECTED.getEpochSecond() + 2);
        JSONObject stats = response.getJSONObject("connection_stats");
        assertThat(stats.getString("id")).isEqualTo("conn_1");
        assertThat(stats.getLong("messages_received")).isEqualTo(3);
        assertThat(stats.getDouble("uptime")).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void testMessageWithoutDataEchoesEmptyString() {
        JSONObject response = dispatch("{\"type\":\"test\"}");

        assertThat(response.getString("echo_data")).isEmpty();
    }

    @Test
    void testMessageEchoesStructuredData() {
        JSONObject response = dispatch("{\"type\":\"test\",\"data\":{\"k\":[1,2]}}");

        assertThat(response.getJSONObject("echo_data").getJSONArray("k").length()).isEqualTo(2);
    }

    @Test
    void heartbeatReportsUptime() {
        JSONObject ack = dispatch("{\"type\":\"heartbeat\"}");

        assertThat(ack.getString("type")).isEqualTo("heartbeat_ack");
        assertThat(ack.getLong("timestamp")).isEqualTo(CONNECTED.getEpochSecond() + 2);
        assertThat(ack.getDouble("connection_uptime")).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void audioStreamReportsStringLength() {
        JSONObject response = dispatch("{\"type\":\"audio_stream\",\"data\":\"xxxxx\"}");

        assertThat(response.getString("type")).isEqualTo("audio_received");
        assertThat(response.getInt("size")).isEqualTo(5);
        assertThat(response.getString("message")).contains("5");
        assertThat(response.has("timestamp")).isTrue();
    }

    @Test
    void audioStreamCountsCodePointsNotUtf16Units() {
        JSONObject response = dispatch("{\"type\":\"audio_stream\",\"data\":\"\uD83D\uDE00\uD83D\uDE00\"}");

        assertThat(response.getInt("size")).isEqualTo(2);
        assertThat(response.getString("message")).contains("(2 bytes)");
    }

    @Test
    void audioStreamWithoutDataHasSizeZero() {
        assertThat(dispatch("{\"type\":\"audio_stream\"}").getInt("size")).isZero();
    }

    @Test
    void audioStreamCountsArrayElements() {
        assertThat(dispatch("{\"type\":\"audio_stream\",\"data\":[1,2,3]}").getInt("size")).isEqualTo(3);
    }

    @Test
    void audioStreamWithNumericDataFails() {
        InboundMessage message = decoder.decode("{\"type\":\"audio_stream\",\"data\":42}");

        assertThatThrownBy(() -> dispatcher.dispatch(message, connection))
                .isInstanceOf(MessageDispatchException.class)
                .hasMessageContaining("audio_stream");
    }

    @Test
    void audioStreamWithNullDataFails() {
        InboundMessage message = decoder.decode("{\"type\":\"audio_stream\",\"data\":null}");

        assertThatThrownBy(() -> dispatcher.dispatch(message, connection))
                .isInstanceOf(MessageDispatchException.class);
    }

    @Test
    void unknownTypeIsEchoedWithFullOriginal() {
        String raw = "{\"type\":\"unrecognized_xyz\",\"n\":7,\"nested\":{\"a\":true}}";

        JSONObject echo = dispatch(raw);

        assertThat(echo.getString("type")).isEqualTo("echo");
        assertThat(echo.getString("original_type")).isEqualTo("unrecognized_xyz");
        assertThat(echo.getString("message")).contains("unrecognized_xyz");
        assertThat(echo.getJSONObject("original_message").similar(new JSONObject(raw))).isTrue();
    }

    @Test
    void messageWithoutTypeIsEchoedAsUnknown() {
        JSONObject echo = dispatch("{\"hello\":\"world\"}");

        assertThat(echo.getString("original_type")).isEqualTo("unknown");
        assertThat(echo.getJSONObject("original_message").getString("hello")).isEqualTo("world");
    }

    @Test
    void repeatedDispatchIsStateless() {
        JSONObject first = dispatch("{\"type\":\"unrecognized_xyz\"}");
        JSONObject second = dispatch("{\"type\":\"unrecognized_xyz\"}");

        assertThat(first.similar(second)).isTrue();
    }

    @Test
    void welcomeCarriesConnectionId() {
        JSONObject welcome = dispatcher.welcome("conn_9");

        assertThat(welcome.getString("type")).isEqualTo("system_ready");
        assertThat(welcome.getString("connection_id")).isEqualTo("conn_9");
        assertThat(welcome.getString("message")).isNotBlank();
        assertThat(welcome.getLong("server_time")).isEqualTo(CONNECTED.getEpochSecond() + 2);
    }

    @Test
    void invalidJsonReplyCarriesParserDetail() {
        JSONObject error = dispatcher.invalidJson("bad token at 1");

        assertThat(error.getString("type")).isEqualTo("error");
        assertThat(error.getString("message")).isEqualTo("Invalid JSON format");
        assertThat(error.getString("error")).isEqualTo("bad token at 1");
    }

    @Test
    void processingErrorHasNoDetail() {
        JSONObject error = dispatcher.processingError();

        assertThat(error.getString("type")).isEqualTo("error");
        assertThat(error.getString("message")).isEqualTo("Server processing error");
        assertThat(error.has("error")).isFalse();
    }
}
