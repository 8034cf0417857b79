package io.dagport.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import io.dagport.spi.ConfigException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;
import org.w3c.dom.Element;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class WorkflowXmlLoaderTest
{
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    @Rule public ExpectedException exception = ExpectedException.none();

    private final WorkflowXmlLoader loader = new WorkflowXmlLoader();

    @Test
    public void loadNamespacedDocument()
            throws Exception
    {
        Element root = loader.loadString(
                "<workflow-app xmlns=\"uri:oozie:workflow:0.5\" name=\"wf\">" +
                "<start to=\"a\"/>" +
                "<action name=\"a\"><shell xmlns=\"uri:oozie:shell-action:0.1\"><exec>run.sh</exec><argument>x</argument><argument> y </argument></shell><ok to=\"end\"/></action>" +
                "<end name=\"end\"/>" +
                "</workflow-app>");

        assertThat(XmlElements.localName(root), is("workflow-app"));
        Element action = XmlElements.children(root, "action").get(0);
        Element shell = XmlElements.child(action, "shell").get();
        assertThat(XmlElements.childText(shell, "exec").get(), is("run.sh"));
        assertThat(XmlElements.childTexts(shell, "argument"), contains("x", "y"));
        assertThat(XmlElements.attribute(action, "name").get(), is("a"));
        assertThat(XmlElements.attribute(action, "missing").isPresent(), is(false));
    }

    @Test
    public void loadFile()
            throws Exception
    {
        Path file = folder.getRoot().toPath().resolve(WorkflowXmlLoader.WORKFLOW_FILE_NAME);
        Files.write(file, "<workflow-app name=\"wf\"><start to=\"end\"/><end name=\"end\"/></workflow-app>".getBytes(UTF_8));

        Element root = loader.load(file);

        assertThat(XmlElements.children(root).size(), is(2));
    }

    @Test
    public void rejectMalformedXml()
            throws Exception
    {
        exception.expect(ConfigException.class);
        exception.expectMessage(containsString("Invalid workflow XML"));
        loader.loadString("<workflow-app><start></workflow-app>");
    }

    @Test
    public void rejectOtherRootElement()
            throws Exception
    {
        exception.expect(ConfigException.class);
        exception.expectMessage(containsString("must be <workflow-app> but got <coordinator-app>"));
        loader.loadString("<coordinator-app xmlns=\"uri:oozie:coordinator:0.4\"/>");
    }

    @Test
    public void rejectDoctype()
            throws Exception
    {
        exception.expect(ConfigException.class);
        loader.loadString("<!DOCTYPE workflow-app [<!ENTITY x \"y\">]><workflow-app>&x;</workflow-app>");
    }
}
