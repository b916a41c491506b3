package com.rfidsync.infrastructure.wildapricot;

import com.rfidsync.domain.exception.FetchException;
import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.port.ContactDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Adaptador del puerto ContactDirectory para la API v2.2 de Wild Apricot.
 * Obtiene un token OAuth (client credentials) y lo reutiliza hasta poco antes de su expiración.
 */
@Component
@Slf4j
public class WildApricotClient implements ContactDirectory {

    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private final RestClient restClient;
    private final Clock clock;

    @Value("${wildapricot.api-key:}")
    private String apiKey;

    @Value("${wildapricot.auth-url:https://oauth.wildapricot.org/auth/token}")
    private String authUrl;

    @Value("${wildapricot.api-url:https://api.wildapricot.org/v2.2}")
    private String apiUrl;

    private String accessToken;
    private Instant tokenExpiresAt = Instant.EPOCH;

    public WildApricotClient(@Qualifier("wildApricotRestClient") RestClient restClient, Clock clock) {
        this.restClient = restClient;
        this.clock = clock;
    }

    @Override
    public List<Contact> fetchContacts(long accountId) {
        String url = apiUrl + "/accounts/" + accountId + "/contacts?$async=false";
        String token = obtainToken();

        log.info("Solicitando contactos de la cuenta {}", accountId);
        ContactsResponse response;
        try {
            response = restClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .body(ContactsResponse.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == 401) {
                invalidateToken();
            }
            throw FetchException.rejected(url, e.getStatusCode().value());
        } catch (RestClientException e) {
            throw FetchException.unreachable(url, e);
        }

        if (response == null || response.contacts() == null) {
            throw FetchException.emptyBody(url);
        }
        return response.contacts();
    }

    /**
     * Token vigente, solicitando uno nuevo si no hay o está por expirar.
     */
    synchronized String obtainToken() {
        Instant now = Instant.now(clock);
        if (accessToken != null && now.isBefore(tokenExpiresAt)) {
            return accessToken;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("scope", "auto");

        TokenResponse token;
        try {
            token = restClient.post()
                    .uri(authUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(h -> h.setBasicAuth("APIKEY", apiKey))
                    .body(form)
                    .retrieve()
                    .body(TokenResponse.class);
        } catch (RestClientResponseException e) {
            throw FetchException.rejected(authUrl, e.getStatusCode().value());
        } catch (RestClientException e) {
            throw FetchException.unreachable(authUrl, e);
        }

        if (token == null || token.accessToken() == null) {
            throw FetchException.emptyBody(authUrl);
        }

        accessToken = token.accessToken();
        tokenExpiresAt = now.plusSeconds(Math.max(0, token.expiresIn() - TOKEN_EXPIRY_MARGIN_SECONDS));
        log.debug("Token OAuth obtenido, expira en {} s", token.expiresIn());
        return accessToken;
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        tokenExpiresAt = Instant.EPOCH;
    }
}
