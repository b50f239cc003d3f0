package com.example.assetconv.render;

import org.apache.batik.anim.dom.SAXSVGDocumentFactory;
import org.apache.batik.bridge.BridgeContext;
import org.apache.batik.bridge.BridgeException;
import org.apache.batik.bridge.DocumentLoader;
import org.apache.batik.bridge.GVTBuilder;
import org.apache.batik.bridge.UserAgent;
import org.apache.batik.bridge.UserAgentAdapter;
import org.apache.batik.gvt.GraphicsNode;
import org.apache.batik.util.XMLResourceDescriptor;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.w3c.dom.svg.SVGDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads SVG files into Batik graphics trees. The media type is sniffed with Tika
 * first so that obviously foreign inputs (PNGs, archives, ...) fail fast.
 */
public class SvgImageLoader implements VectorImageLoader {
    private static final MediaType SVG = MediaType.parse("image/svg+xml");

    private final Tika tika;

    public SvgImageLoader(Tika tika) {
        this.tika = tika;
    }

    @Override
    public VectorImage load(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new IOException("Cannot read '" + source + "'.");
        }
        MediaType mediaType = detectMediaType(source);
        if (!isVectorCandidate(mediaType)) {
            throw new IOException("Cannot parse '" + source + "': unsupported media type " + mediaType);
        }

        SAXSVGDocumentFactory factory = new SAXSVGDocumentFactory(XMLResourceDescriptor.getXMLParserClassName());
        SVGDocument document;
        try {
            document = factory.createSVGDocument(source.toUri().toString());
        } catch (IOException ex) {
            throw new IOException("Cannot parse '" + source + "'.", ex);
        }

        UserAgent userAgent = new UserAgentAdapter();
        BridgeContext context = new BridgeContext(userAgent, new DocumentLoader(userAgent));
        context.setDynamicState(BridgeContext.STATIC);
        try {
            GraphicsNode root = new GVTBuilder().build(context, document);
            return new VectorImage(
                    source,
                    root,
                    (float) context.getDocumentSize().getWidth(),
                    (float) context.getDocumentSize().getHeight()
            );
        } catch (BridgeException ex) {
            throw new IOException("Cannot parse '" + source + "': " + ex.getMessage(), ex);
        }
    }

    private MediaType detectMediaType(Path source) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(source));
            return mediaType == null ? MediaType.OCTET_STREAM : mediaType;
        } catch (IOException ex) {
            return MediaType.OCTET_STREAM;
        }
    }

    private boolean isVectorCandidate(MediaType mediaType) {
        // SVG without a prolog or extension is often reported as generic XML or text.
        MediaType base = mediaType.getBaseType();
        return SVG.equals(base)
                || base.getSubtype().endsWith("xml")
                || MediaType.TEXT_PLAIN.equals(base);
    }
}
