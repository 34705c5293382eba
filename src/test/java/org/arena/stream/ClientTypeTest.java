package org.arena.stream;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClientTypeTest {

    @Test
    void detectsKnownClients() {
        assertEquals(ClientType.CLAUDE, ClientType.detect("claude-cli/1.0.3 (external, cli)"));
        assertEquals(ClientType.CLAUDE, ClientType.detect("Anthropic/Python 0.39.0"));
        assertEquals(ClientType.GEMINI, ClientType.detect("GeminiCLI/0.1.5"));
        assertEquals(ClientType.CODEX, ClientType.detect("codex_cli_rs/0.2.0"));
        assertEquals(ClientType.OPENCODE, ClientType.detect("opencode/0.3.1"));
    }

    @Test
    void unknownOrMissingIsOpenAi() {
        assertEquals(ClientType.OPENAI, ClientType.detect("OpenAI/Python 1.30.1"));
        assertEquals(ClientType.OPENAI, ClientType.detect("curl/8.4.0"));
        assertEquals(ClientType.OPENAI, ClientType.detect(null));
    }
}
