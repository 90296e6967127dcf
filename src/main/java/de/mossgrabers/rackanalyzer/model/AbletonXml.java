// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.model;

import de.mossgrabers.rackanalyzer.utils.StreamHelper;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;


/**
 * Support for reading the (compressed) XML documents of Ableton rack presets into a tree of nodes.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonXml
{
    /**
     * Constructor.
     */
    private AbletonXml ()
    {
        // Intentionally empty
    }


    /**
     * Parses a rack document. The content can be GZIP compressed (as stored in the preset files)
     * or plain XML.
     *
     * @param input The stream to read from
     * @return The root node of the document
     * @throws IOException Could not read from the stream
     * @throws ParseException The content is not well-formed XML
     */
    public static XmlNode parse (final InputStream input) throws IOException, ParseException
    {
        final Document document;
        try
        {
            final DocumentBuilder builder = createFactory ().newDocumentBuilder ();
            document = builder.parse (StreamHelper.uncompressIfNecessary (input));
        }
        catch (final ParserConfigurationException ex)
        {
            throw new IOException ("Could not create XML parser.", ex);
        }
        catch (final SAXParseException ex)
        {
            final ParseException parseException = new ParseException ("Malformed XML at line " + ex.getLineNumber () + ": " + ex.getMessage (), Math.max (0, ex.getLineNumber ()));
            parseException.initCause (ex);
            throw parseException;
        }
        catch (final SAXException ex)
        {
            final ParseException parseException = new ParseException ("Malformed XML: " + ex.getMessage (), 0);
            parseException.initCause (ex);
            throw parseException;
        }

        return convertElement (document.getDocumentElement ());
    }


    /**
     * Parses a rack document from a text.
     *
     * @param xml The XML text
     * @return The root node of the document
     * @throws ParseException The content is not well-formed XML
     */
    public static XmlNode parse (final String xml) throws ParseException
    {
        try
        {
            return parse (new ByteArrayInputStream (xml.getBytes (StandardCharsets.UTF_8)));
        }
        catch (final IOException ex)
        {
            // Reading from memory does not fail but the parser configuration might
            throw new IllegalStateException (ex);
        }
    }


    /**
     * Creates a parser factory which does not resolve any DTDs or external entities.
     *
     * @return The factory
     * @throws ParserConfigurationException A feature is not supported
     */
    private static DocumentBuilderFactory createFactory () throws ParserConfigurationException
    {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
        factory.setNamespaceAware (false);
        factory.setValidating (false);
        factory.setExpandEntityReferences (false);
        factory.setFeature (XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature ("http://apache.org/xml/features/disallow-doctype-decl", true);
        return factory;
    }


    /**
     * Converts a DOM element and all its' child elements. Text content is dropped since the rack
     * documents store all values in attributes.
     *
     * @param element The element to convert
     * @return The node
     */
    private static XmlNode convertElement (final Element element)
    {
        final XmlNode node = new XmlNode (element.getTagName ());

        final NamedNodeMap attributes = element.getAttributes ();
        for (int i = 0; i < attributes.getLength (); i++)
        {
            final Attr attribute = (Attr) attributes.item (i);
            node.setAttribute (attribute.getName (), attribute.getValue ());
        }

        final NodeList children = element.getChildNodes ();
        for (int i = 0; i < children.getLength (); i++)
        {
            final Node child = children.item (i);
            if (child.getNodeType () == Node.ELEMENT_NODE)
                node.addChildNode (convertElement ((Element) child));
        }
        return node;
    }
}
