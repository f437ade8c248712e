package com.acme.workplan.identity;

import com.acme.workplan.common.InvalidArgumentException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

@Component
public class ProjectIdentity {

    public IdentityDtos.ProjectIdResponse identify(String descriptor) {
        if (descriptor == null || descriptor.isEmpty()) {
            throw new InvalidArgumentException("Project descriptor must be a non-empty string");
        }
        String projectId = Base64.getUrlEncoder().encodeToString(utf8(descriptor));
        return new IdentityDtos.ProjectIdResponse(projectId, descriptor);
    }

    public IdentityDtos.ProjectIdResponse decode(String projectId) {
        if (projectId == null || projectId.isEmpty()) {
            throw new InvalidArgumentException("Project id must be a non-empty string");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(projectId);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Not a valid project id: " + projectId);
        }
        String descriptor = new String(raw, StandardCharsets.UTF_8);
        // reject ids that decode but are not in canonical form
        if (!identify(descriptor).projectId().equals(projectId)) {
            throw new InvalidArgumentException("Not a valid project id: " + projectId);
        }
        return new IdentityDtos.ProjectIdResponse(projectId, descriptor);
    }

    private static byte[] utf8(String descriptor) {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(descriptor));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new InvalidArgumentException("Project descriptor is not well-formed Unicode text");
        }
    }
}
