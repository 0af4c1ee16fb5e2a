package com.framesmith.core.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * {@link CodeOracle} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Spring AI's own retry is turned off in configuration; failures are classified here and the
 * {@link CodeOracleAdapter} owns the retry budget.
 */
@Service
public class ChatClientCodeOracle implements CodeOracle {

    private static final Logger log = LoggerFactory.getLogger(ChatClientCodeOracle.class);

    private final ChatClient chatClient;

    public ChatClientCodeOracle(ChatClient.Builder builder,
                                @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("ChatClientCodeOracle initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public OracleResponse generate(OracleRequest request) {
        log.info("Oracle call started for screen {}", request.screenId());
        long start = System.currentTimeMillis();
        ChatResponse chatResponse;
        try {
            chatResponse = chatClient.prompt()
                    .system(request.systemPrompt())
                    .user(request.userPrompt())
                    .call()
                    .chatResponse();
        } catch (TransientAiException e) {
            throw new TransientOracleException("Oracle temporarily unavailable: " + e.getMessage(), e);
        } catch (NonTransientAiException e) {
            throw new OracleRequestException("Oracle rejected request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (hasIoCause(e)) {
                throw new TransientOracleException("Oracle connection failed: " + e.getMessage(), e);
            }
            throw new OracleRequestException("Oracle call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;

        if (chatResponse == null || chatResponse.getResult() == null
                || chatResponse.getResult().getOutput() == null) {
            throw new TransientOracleException("Oracle returned no generation for screen " + request.screenId());
        }
        String content = chatResponse.getResult().getOutput().getText();
        long tokens = -1L;
        var metadata = chatResponse.getMetadata();
        if (metadata != null && metadata.getUsage() != null && metadata.getUsage().getTotalTokens() != null
                && metadata.getUsage().getTotalTokens() > 0) {
            tokens = metadata.getUsage().getTotalTokens();
        }
        log.info("Oracle call complete for screen {} ({}s, {} chars)", request.screenId(),
                String.format("%.1f", elapsed / 1000.0), content == null ? 0 : content.length());
        return new OracleResponse(content, tokens);
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) {
                return true;
            }
        }
        return false;
    }
}
