package io.dagport.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import io.dagport.spi.ConfigException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

public class WorkflowXmlLoader
{
    public static final String WORKFLOW_FILE_NAME = "workflow.xml";

    public Element load(Path file)
        throws IOException
    {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(new InputSource(in), file.toString());
        }
    }

    public Element loadString(String content)
        throws IOException
    {
        return parse(new InputSource(new StringReader(content)), "<string>");
    }

    private Element parse(InputSource source, String sourceName)
        throws IOException
    {
        Document document;
        try {
            document = newDocumentBuilder().parse(source);
        }
        catch (SAXException ex) {
            throw new ConfigException("Invalid workflow XML in " + sourceName + ": " + ex.getMessage(), ex);
        }
        Element root = document.getDocumentElement();
        if (!XmlElements.localName(root).equals("workflow-app")) {
            throw new ConfigException("Root element of " + sourceName + " must be <workflow-app> but got <" + XmlElements.localName(root) + ">");
        }
        return root;
    }

    private static DocumentBuilder newDocumentBuilder()
    {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newDocumentBuilder();
        }
        catch (ParserConfigurationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
