package gitclone.core.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.config.ClientConfig;
import gitclone.exceptions.GitException;
import gitclone.exceptions.TransportException;

/**
 * Anonymous smart-HTTP client for {@code git-upload-pack}.
 *
 * ┌─ GET  <url>/info/refs?service=git-upload-pack → ref advertisement
 * └─ POST <url>/git-upload-pack (want lines, flush, done) → NAK + pack
 */
public class SmartHttpTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(SmartHttpTransport.class);

    static final String SERVICE = "git-upload-pack";
    static final String ADVERTISEMENT_TYPE = "application/x-git-upload-pack-advertisement";
    static final String REQUEST_TYPE = "application/x-git-upload-pack-request";
    static final String RESULT_TYPE = "application/x-git-upload-pack-result";

    private final String baseUrl;
    private final HttpClient client;
    private final ClientConfig config;

    public SmartHttpTransport(String url, ClientConfig config) {
        this(url, config, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public SmartHttpTransport(String url, ClientConfig config, HttpClient client) {
        this.baseUrl = stripTrailingSlash(url);
        this.config = config;
        this.client = client;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public RefAdvertisement discoverRefs() throws GitException {
        URI uri = URI.create(baseUrl + "/info/refs?service=" + SERVICE);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent())
                .GET()
                .build();

        HttpResponse<byte[]> response = send(request, "ref discovery");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!contentType.startsWith(ADVERTISEMENT_TYPE)) {
            logger.warn("Unexpected ref advertisement content type '{}' from {}", contentType, uri);
        }

        RefAdvertisement advertisement = RefAdvertisement.parse(response.body());
        logger.info("Discovered {} refs at {}", advertisement.getRefs().size(), baseUrl);
        return advertisement;
    }

    @Override
    public byte[] fetchPack(UploadPackRequest uploadRequest) throws GitException {
        URI uri = URI.create(baseUrl + "/" + SERVICE);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Content-Type", REQUEST_TYPE)
                .header("Accept", RESULT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(uploadRequest.encode()))
                .build();

        logger.debug("Requesting {} objects from {}", uploadRequest.getWants().size(), uri);
        HttpResponse<byte[]> response = send(request, "pack retrieval");
        byte[] pack = PackResponse.extractPack(response.body());
        logger.info("Received pack of {} bytes", pack.length);
        return pack;
    }

    private HttpResponse<byte[]> send(HttpRequest request, String stage) throws TransportException {
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new TransportException(stage + " failed for " + request.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(stage + " interrupted for " + request.uri(), e);
        }

        if (response.statusCode() != 200) {
            throw new TransportException(stage + " failed for " + request.uri()
                    + ": HTTP " + response.statusCode());
        }
        return response;
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
