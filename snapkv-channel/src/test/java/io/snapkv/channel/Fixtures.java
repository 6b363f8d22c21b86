package io.snapkv.channel;

import com.google.gson.Gson;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

final class Fixtures {

    static final String CHANNEL_JSON = """
        {
          "name": "test channel",
          "on": true,
          "publish_points": [
            {
              "id": "pub1",
              "format": "hls",
              "drms": ["fairplay"],
              "url": "http://example.com"
            }
          ],
          "region": "us-west",
          "segment_duration": 6,
          "video_encoders": [
            {
              "bitrate": 2000,
              "framerate": 30,
              "height": 1080,
              "id": "hd",
              "width": 1920
            }
          ]
        }
        """;

    private Fixtures() {}

    static Channel channel() {
        return new Gson().fromJson(CHANNEL_JSON, Channel.class);
    }

    static Channel channel(String name) {
        return new Channel(
            name,
            "us-east",
            false,
            4,
            List.of("event"),
            List.of(new VideoEncoder("hd", 1280, 720, 3000, 29.97)),
            List.of(new PublishPoint("pub1", "dash", "https://cdn.example.com/live", List.of("widevine"),
                Map.of("X-Token", "abc")))
        );
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
