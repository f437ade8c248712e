package com.acme.workplan.identity;

import com.acme.workplan.common.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectIdentityTest {

    private final ProjectIdentity identity = new ProjectIdentity();

    @Test
    @DisplayName("same descriptor always yields the same id")
    void deterministic() {
        String descriptor = "/home/dev/repos/mcp-agent-tasks";
        assertEquals(identity.identify(descriptor), identity.identify(descriptor));
    }

    @Test
    @DisplayName("distinct descriptors yield distinct ids")
    void distinct() {
        assertNotEquals(identity.identify("https://github.com/user/repo.git").projectId(),
                identity.identify("https://github.com/user/repo2.git").projectId());
    }

    @Test
    void matchesStandardBase64WhenNoUrlUnsafeCharactersAppear() {
        assertEquals("aHR0cHM6Ly9naXRodWIuY29tL3VzZXIvcmVwby5naXQ=",
                identity.identify("https://github.com/user/repo.git").projectId());
    }

    @Test
    void idIsSafeInUrlPaths() {
        // standard base64 of this input is Pz8/fn5+
        String projectId = identity.identify("???~~~").projectId();
        assertEquals("Pz8_fn5-", projectId);
        assertFalse(projectId.contains("/"));
        assertFalse(projectId.contains("+"));
    }

    @Test
    void descriptorIsRecoverable() {
        String descriptor = "git@gitlab.example.com:platform/ünïcode-repo.git";
        var id = identity.identify(descriptor);
        assertEquals(descriptor, id.rawValue());
        assertEquals(descriptor, identity.decode(id.projectId()).rawValue());
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(InvalidArgumentException.class, () -> identity.identify(""));
        assertThrows(InvalidArgumentException.class, () -> identity.identify(null));
    }

    @Test
    void rejectsDescriptorsThatCannotRoundTrip() {
        // lone high surrogate has no UTF-8 form
        assertThrows(InvalidArgumentException.class, () -> identity.identify("repo-\uD800"));
        assertThrows(InvalidArgumentException.class, () -> identity.identify("\uDC00/path"));
    }

    @Test
    void rejectsIdsThatAreNotEncodings() {
        assertThrows(InvalidArgumentException.class, () -> identity.decode("not base64!"));
        assertThrows(InvalidArgumentException.class, () -> identity.decode(""));
    }
}
