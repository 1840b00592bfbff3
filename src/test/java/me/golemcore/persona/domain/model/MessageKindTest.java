package me.golemcore.persona.domain.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageKindTest {

    @Test
    void shouldResolveKnownKindsCaseInsensitively() {
        assertEquals(MessageKind.TEXT, MessageKind.fromValue("text"));
        assertEquals(MessageKind.MFACE, MessageKind.fromValue(" MFace "));
        assertEquals(MessageKind.IMAGE, MessageKind.fromValue("image"));
    }

    @Test
    void shouldMapUnknownAndMissingKindsToOther() {
        assertEquals(MessageKind.OTHER, MessageKind.fromValue("record"));
        assertEquals(MessageKind.OTHER, MessageKind.fromValue(null));
        assertEquals(MessageKind.OTHER, MessageKind.fromValue(""));
    }

    @Test
    void shouldNeverAllowOtherThroughConfiguration() {
        Set<MessageKind> kinds = MessageKind.parseAll(List.of("text", "video", "image"));

        assertEquals(EnumSet.of(MessageKind.TEXT, MessageKind.IMAGE), kinds);
    }

    @Test
    void shouldTreatImagesAndStickersAsVisual() {
        assertTrue(MessageKind.IMAGE.isVisual());
        assertTrue(MessageKind.MFACE.isVisual());
        assertFalse(MessageKind.TEXT.isVisual());
    }
}
