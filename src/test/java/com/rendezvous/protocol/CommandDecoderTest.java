package com.rendezvous.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text.replace('\'', '"'));
    }

    private static RendezvousException rejected(String text) throws Exception {
        var frame = json(text);
        return assertThrows(RendezvousException.class, () -> CommandDecoder.decode(frame));
    }

    @Test
    void decodesEveryCommand() throws Exception {
        assertEquals(new Command.Bind("x", "a"), CommandDecoder.decode(json("{'type':'bind','appId':'x','side':'a'}")));
        assertEquals(new Command.ListNameplates(), CommandDecoder.decode(json("{'type':'list'}")));
        assertEquals(new Command.Allocate(), CommandDecoder.decode(json("{'type':'allocate'}")));
        assertEquals(new Command.Claim("4"), CommandDecoder.decode(json("{'type':'claim','channelId':'4'}")));
        assertEquals(new Command.Watch("4"), CommandDecoder.decode(json("{'type':'watch','channelId':'4'}")));
        assertEquals(new Command.Release("4", "happy"),
                CommandDecoder.decode(json("{'type':'release','channelId':'4','mood':'happy'}")));
        assertEquals(new Command.Release("4", null), CommandDecoder.decode(json("{'type':'release','channelId':'4'}")));
        assertEquals(new Command.Add("4", "pake", "ab12", TextNode.valueOf("m1")),
                CommandDecoder.decode(json("{'type':'add','channelId':'4','phase':'pake','body':'ab12','msgId':'m1'}")));
    }

    @Test
    void ignoresUnknownKeys() throws Exception {
        assertEquals(new Command.Claim("4"),
                CommandDecoder.decode(json("{'type':'claim','channelId':'4','nameplate':'9','future':true}")));
    }

    @Test
    void missingTypeOnObjectAndNonObject() throws Exception {
        assertEquals(RendezvousException.Kind.MISSING_TYPE, rejected("{'side':'a'}").kind());
        assertEquals(RendezvousException.Kind.MISSING_TYPE, rejected("{'type':null}").kind());
        assertEquals(RendezvousException.Kind.MISSING_TYPE, rejected("['bind']").kind());
    }

    @Test
    void unknownType() throws Exception {
        var e = rejected("{'type':'open','mailbox':'m'}");
        assertEquals(RendezvousException.Kind.UNKNOWN_TYPE, e.kind());
        assertEquals("Unknown type", e.explain());
    }

    @Test
    void missingChannelIdNamesTheCommand() throws Exception {
        assertEquals("watch requires 'channelId'", rejected("{'type':'watch'}").explain());
        assertEquals("add requires 'channelId'", rejected("{'type':'add','phase':'p','body':'00'}").explain());
        assertEquals("release requires 'channelId'", rejected("{'type':'release'}").explain());
        assertEquals(RendezvousException.Kind.MISSING_FIELD, rejected("{'type':'claim'}").kind());
    }

    @Test
    void onlyPingAndBindAllowedUnbound() {
        assertTrue(CommandDecoder.allowedUnbound("ping"));
        assertTrue(CommandDecoder.allowedUnbound("bind"));
        assertFalse(CommandDecoder.allowedUnbound("list"));
        assertFalse(CommandDecoder.allowedUnbound("nonsense"));
    }
}
