package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.exception.RecognitionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Objects;

/**
 * Sends utterances to a Google-compatible speech endpoint as raw 16 kHz L16 audio.
 */
@Service
public class RemoteRecognitionService implements RecognitionService {

    private static final Logger LOG = LogManager.getLogger(RemoteRecognitionService.class);

    static final MediaType L16_16K = MediaType.parseMediaType("audio/l16; rate=16000");

    private final RestTemplate restTemplate;
    private final RecognitionProperties props;

    public RemoteRecognitionService(@Qualifier("recognitionRestTemplate") RestTemplate restTemplate,
                                    RecognitionProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public RecognitionResponse recognize(AudioClip clip) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(L16_16K);
        HttpEntity<byte[]> request = new HttpEntity<>(clip.pcm(), headers);

        String body;
        try {
            body = restTemplate.postForObject(requestUri(), request, String.class);
        } catch (RestClientResponseException e) {
            throw new RecognitionException("Recognition request rejected with HTTP " + e.getStatusCode().value(),
                    RecognitionException.Reason.UNAVAILABLE, e);
        } catch (RestClientException e) {
            throw new RecognitionException("Recognition service unreachable",
                    RecognitionException.Reason.UNAVAILABLE, e);
        }
        LOG.debug("Recognition response: {} chars for {} ms of audio",
                body == null ? 0 : body.length(), clip.durationMillis());
        return RecognitionResponseParser.parse(body);
    }

    URI requestUri() {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(props.getEndpoint())
                .queryParam("output", "json")
                .queryParam("lang", props.getLanguage());
        if (props.getApiKey() != null) {
            builder.queryParam("key", props.getApiKey());
        }
        return builder.build().encode().toUri();
    }
}
