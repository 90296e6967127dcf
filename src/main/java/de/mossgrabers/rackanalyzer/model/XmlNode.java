// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;


/**
 * An element in a rack document with its' attributes and ordered child elements.
 *
 * @author Jürgen Moßgraber
 */
public class XmlNode
{
    private final String              tag;
    private final Map<String, String> attributes = new LinkedHashMap<> ();
    private final List<XmlNode>       childNodes = new ArrayList<> ();


    /**
     * Constructor.
     *
     * @param tag The tag name of the element
     */
    public XmlNode (final String tag)
    {
        this.tag = tag;
    }


    /**
     * Get the tag name of the node.
     *
     * @return The tag
     */
    public String getTag ()
    {
        return this.tag;
    }


    /**
     * Set an attribute of the node.
     *
     * @param name The name of the attribute
     * @param value The value
     */
    public void setAttribute (final String name, final String value)
    {
        this.attributes.put (name, value);
    }


    /**
     * Get the value of an attribute.
     *
     * @param name The name of the attribute
     * @return The value or empty if the attribute is not present
     */
    public Optional<String> getAttribute (final String name)
    {
        return Optional.ofNullable (this.attributes.get (name));
    }


    /**
     * Add a child node.
     *
     * @param node The node to add
     */
    public void addChildNode (final XmlNode node)
    {
        this.childNodes.add (node);
    }


    /**
     * Get all child nodes.
     *
     * @return The child nodes in document order
     */
    public List<XmlNode> getChildNodes ()
    {
        return Collections.unmodifiableList (this.childNodes);
    }


    /**
     * Lookup a child node with a certain tag.
     *
     * @param tag The tag of the node to look up
     * @return The first matching node or empty if not found
     */
    public Optional<XmlNode> getChildNode (final String tag)
    {
        for (final XmlNode childNode: this.childNodes)
        {
            if (tag.equals (childNode.tag))
                return Optional.of (childNode);
        }
        return Optional.empty ();
    }


    /**
     * Lookup all child nodes with a certain tag.
     *
     * @param tag The tag of the nodes to look up
     * @return The matching nodes, might be empty
     */
    public List<XmlNode> getChildNodes (final String tag)
    {
        final List<XmlNode> results = new ArrayList<> ();
        for (final XmlNode childNode: this.childNodes)
        {
            if (tag.equals (childNode.tag))
                results.add (childNode);
        }
        return results;
    }


    /**
     * Follow a path of child tags separated by '/', e.g. "On/Manual". Each step takes the first
     * matching child.
     *
     * @param path The path relative to this node
     * @return The node at the end of the path or empty if one of the steps does not exist
     */
    public Optional<XmlNode> getPath (final String path)
    {
        Optional<XmlNode> current = Optional.of (this);
        for (final String step: path.split ("/"))
        {
            current = current.get ().getChildNode (step);
            if (current.isEmpty ())
                break;
        }
        return current;
    }


    /**
     * Depth-first search for the first descendant with the given tag. The node itself is not
     * included.
     *
     * @param tag The tag to look for
     * @return The first match in document order or empty if none exists
     */
    public Optional<XmlNode> findDescendant (final String tag)
    {
        final Deque<XmlNode> stack = new ArrayDeque<> ();
        pushChildren (stack, this);
        while (!stack.isEmpty ())
        {
            final XmlNode node = stack.pop ();
            if (tag.equals (node.tag))
                return Optional.of (node);
            pushChildren (stack, node);
        }
        return Optional.empty ();
    }


    /**
     * Depth-first search for all descendants with the given tag. The node itself is not included.
     *
     * @param tag The tag to look for
     * @return All matches in document order
     */
    public List<XmlNode> findDescendants (final String tag)
    {
        final List<XmlNode> results = new ArrayList<> ();
        final Deque<XmlNode> stack = new ArrayDeque<> ();
        pushChildren (stack, this);
        while (!stack.isEmpty ())
        {
            final XmlNode node = stack.pop ();
            if (tag.equals (node.tag))
                results.add (node);
            pushChildren (stack, node);
        }
        return results;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return "<" + this.tag + " " + this.attributes + "> (" + this.childNodes.size () + " children)";
    }


    private static void pushChildren (final Deque<XmlNode> stack, final XmlNode node)
    {
        for (int i = node.childNodes.size () - 1; i >= 0; i--)
            stack.push (node.childNodes.get (i));
    }
}
