package com.example.baselinediff.client.manifest;

import com.example.baselinediff.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads {@code <root>/.repo/manifest.xml} into the list of projects it declares.
 *
 * Handles {@code <remote>}, {@code <default>}, {@code <project>},
 * {@code <remove-project>} and {@code <include>}; includes resolve against
 * {@code <root>/.repo/manifests/}. Other elements are ignored.
 */
@Component
@Slf4j
public class ManifestReader {

    static final String MANIFEST_FILE = "manifest.xml";
    static final String REPO_DIR = ".repo";
    static final String MANIFESTS_DIR = "manifests";
    private static final int MAX_INCLUDE_DEPTH = 16;

    private final SAXParserFactory parserFactory;

    public ManifestReader() {
        try {
            parserFactory = SAXParserFactory.newInstance();
            parserFactory.setNamespaceAware(false);
            parserFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            parserFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException("No usable XML parser available", e);
        }
    }

    /**
     * @throws ResourceNotFoundException when the manifest or one of its includes is missing
     * @throws IOException when a manifest cannot be read or parsed
     */
    public List<ManifestProject> read(Path treeRoot) throws IOException {
        Path repoDir = treeRoot.resolve(REPO_DIR);
        Path manifest = repoDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            throw ResourceNotFoundException.manifestNotFound(manifest);
        }

        Handler handler = new Handler(repoDir.resolve(MANIFESTS_DIR));
        handler.parse(manifest, 0);

        List<ManifestProject> projects = handler.resolve(treeRoot);
        log.info("Read manifest {}: {} projects, {} remotes", manifest, projects.size(), handler.remotes.size());
        return projects;
    }

    private final class Handler extends DefaultHandler {

        private final Path includeDir;
        private final Map<String, String> remotes = new HashMap<>();
        private final Map<String, String[]> projects = new LinkedHashMap<>();
        private String defaultRemote;
        private int depth;

        private Handler(Path includeDir) {
            this.includeDir = includeDir;
        }

        private void parse(Path file, int includeDepth) throws IOException {
            if (includeDepth > MAX_INCLUDE_DEPTH) {
                throw new IOException("Manifest includes nested deeper than " + MAX_INCLUDE_DEPTH + " at " + file);
            }
            int saved = depth;
            depth = includeDepth;
            try (InputStream in = Files.newInputStream(file)) {
                SAXParser parser = parserFactory.newSAXParser();
                parser.parse(in, this);
            } catch (ParserConfigurationException e) {
                throw new IOException("Cannot create XML parser", e);
            } catch (SAXException e) {
                if (e.getException() instanceof ResourceNotFoundException notFound) {
                    throw notFound;
                }
                if (e.getException() instanceof IOException io) {
                    throw io;
                }
                throw new IOException("Invalid manifest " + file + ": " + e.getMessage(), e);
            } finally {
                depth = saved;
            }
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes)
                throws SAXException {
            switch (qName) {
                case "remote" -> {
                    String name = attributes.getValue("name");
                    String fetch = attributes.getValue("fetch");
                    if (name != null && fetch != null) {
                        remotes.put(name, stripTrailingSlashes(fetch));
                    }
                }
                case "default" -> {
                    String remote = attributes.getValue("remote");
                    if (remote != null) {
                        defaultRemote = remote;
                    }
                }
                case "project" -> {
                    String name = attributes.getValue("name");
                    if (name == null || name.isBlank()) {
                        log.warn("Skipping manifest project without a name");
                        return;
                    }
                    if (projects.containsKey(name)) {
                        log.warn("Duplicate manifest project {}; keeping the first declaration", name);
                        return;
                    }
                    projects.put(name, new String[]{attributes.getValue("path"), attributes.getValue("remote")});
                }
                case "remove-project" -> projects.remove(attributes.getValue("name"));
                case "include" -> include(attributes.getValue("name"));
                default -> {
                    // annotations, copyfile, linkfile and the rest carry nothing we store
                }
            }
        }

        private void include(String name) throws SAXException {
            if (name == null) {
                return;
            }
            Path file = includeDir.resolve(name).normalize();
            if (!Files.isRegularFile(file)) {
                throw new SAXException(ResourceNotFoundException.manifestNotFound(file));
            }
            try {
                parse(file, depth + 1);
            } catch (IOException | ResourceNotFoundException e) {
                throw new SAXException(e);
            }
        }

        private List<ManifestProject> resolve(Path treeRoot) {
            List<ManifestProject> resolved = new ArrayList<>(projects.size());
            projects.forEach((name, attrs) -> {
                String path = attrs[0] != null && !attrs[0].isBlank() ? attrs[0] : name;
                String remote = attrs[1] != null ? attrs[1] : defaultRemote;
                String remoteUrl = remote != null ? remotes.get(remote) : null;
                resolved.add(ManifestProject.builder()
                        .name(name)
                        .path(path)
                        .directory(treeRoot.resolve(path).normalize())
                        .remoteUrl(remoteUrl == null || remoteUrl.isEmpty() ? null : remoteUrl)
                        .build());
            });
            return resolved;
        }
    }

    static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }
}
