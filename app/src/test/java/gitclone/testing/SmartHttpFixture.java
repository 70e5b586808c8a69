package gitclone.testing;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.ContextHandlerCollection;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import gitclone.core.transport.PktLine;

/**
 * In-process smart-HTTP remote serving a fixed ref advertisement and a fixed
 * upload-pack response from a Jetty server on an ephemeral localhost port.
 * Request bodies sent to upload-pack are recorded.
 */
public class SmartHttpFixture implements AutoCloseable {
    private static final String HOST = "127.0.0.1";
    private static final String CONTEXT_PATH = "/repo.git";

    private final Server server;
    private final ServerConnector connector;
    private final List<byte[]> uploadRequests = new CopyOnWriteArrayList<>();
    private volatile int refsStatus = HttpServletResponse.SC_OK;

    public SmartHttpFixture(byte[] advertisement, byte[] uploadPackResponse) throws Exception {
        server = new Server();

        HttpConfiguration config = new HttpConfiguration();
        connector = new ServerConnector(server, new HttpConnectionFactory(config));
        connector.setPort(0);
        connector.setHost(HOST);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath(CONTEXT_PATH);
        ctx.addServlet(new ServletHolder(new InfoRefsServlet(advertisement)), "/info/refs");
        ctx.addServlet(new ServletHolder(new UploadPackServlet(uploadPackResponse)), "/git-upload-pack");

        ContextHandlerCollection contexts = new ContextHandlerCollection();
        contexts.addHandler(ctx);

        server.setConnectors(new Connector[] { connector });
        server.setHandler(contexts);
        server.start();
    }

    /**
     * Builds a smart-HTTP advertisement body, service banner included. The
     * first line carries {@code capabilities}.
     */
    public static byte[] advertisement(String capabilities, String... refLines) {
        PktLine.Writer writer = new PktLine.Writer()
                .line("# service=git-upload-pack\n")
                .flush();
        for (int i = 0; i < refLines.length; i++) {
            String line = i == 0 ? refLines[i] + "\0" + capabilities : refLines[i];
            writer.line(line + "\n");
        }
        return writer.flush().toByteArray();
    }

    public String url() {
        return "http://" + HOST + ":" + connector.getLocalPort() + CONTEXT_PATH;
    }

    public List<byte[]> getUploadRequests() {
        return uploadRequests;
    }

    public void setRefsStatus(int status) {
        this.refsStatus = status;
    }

    private static void respond(HttpServletResponse resp, int status, String contentType, byte[] body)
            throws IOException {
        resp.setStatus(status);
        resp.setContentType(contentType);
        resp.setContentLength(body.length);
        if (body.length > 0) {
            resp.getOutputStream().write(body);
        }
    }

    private class InfoRefsServlet extends HttpServlet {
        private static final long serialVersionUID = 1L;

        private final byte[] advertisement;

        InfoRefsServlet(byte[] advertisement) {
            this.advertisement = advertisement;
        }

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            if (!"git-upload-pack".equals(req.getParameter("service"))) {
                respond(resp, HttpServletResponse.SC_FORBIDDEN, "text/plain", new byte[0]);
                return;
            }
            respond(resp, refsStatus, "application/x-git-upload-pack-advertisement", advertisement);
        }
    }

    private class UploadPackServlet extends HttpServlet {
        private static final long serialVersionUID = 1L;

        private final byte[] response;

        UploadPackServlet(byte[] response) {
            this.response = response;
        }

        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            uploadRequests.add(req.getInputStream().readAllBytes());
            respond(resp, HttpServletResponse.SC_OK, "application/x-git-upload-pack-result", response);
        }
    }

    @Override
    public void close() throws Exception {
        server.stop();
    }
}
