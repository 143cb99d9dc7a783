package ai.contextsync.context;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/** A content block of the message that tells the agent about file changes. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({@JsonSubTypes.Type(MessageContent.Text.class), @JsonSubTypes.Type(MessageContent.Image.class)})
public sealed interface MessageContent permits MessageContent.Text, MessageContent.Image {

    @JsonTypeName("text")
    record Text(String text) implements MessageContent {}

    @JsonTypeName("image")
    record Image(ImageSource source) implements MessageContent {
        public static Image base64(String mediaType, String data) {
            return new Image(new ImageSource("base64", mediaType, data));
        }
    }

    record ImageSource(String type, @JsonProperty("media_type") String mediaType, String data) {}
}
