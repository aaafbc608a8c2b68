package com.example.seer.collaborator;

import com.example.seer.config.SeerProperties;
import com.example.seer.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class HttpCodeFixGenerator implements CodeFixGenerator {

    static final String NAME = "fix-generation";

    private final HttpCollaboratorClient client;
    private final SeerProperties properties;

    @Override
    public CodeFixResult generate(CodeFixRequest request) {
        CodeFixResult result = client.post(NAME, properties.getCollaborators().getFixGenerationUrl(),
                request, CodeFixResult.class);
        if (result.fixedCode() == null || result.fixedCode().isBlank()) {
            throw new CollaboratorException(NAME, "no fixed code returned for " + request.filePath());
        }
        return result;
    }
}
