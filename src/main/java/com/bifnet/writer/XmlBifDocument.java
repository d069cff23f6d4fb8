package com.bifnet.writer;

import com.bifnet.writer.WriterDtos.WriterOptions;
import com.bifnet.writer.WriterDtos.XmlNode;

/**
 * A fully built XMLBIF tree together with the options it is serialized with.
 */
public final class XmlBifDocument {
    private final XmlNode root;
    private final WriterOptions options;

    XmlBifDocument(XmlNode root, WriterOptions options) {
        this.root = root;
        this.options = options;
    }

    public XmlNode root() {
        return root;
    }

    public XmlNode network() {
        return root.children("NETWORK").get(0);
    }

    public WriterOptions options() {
        return options;
    }

    public byte[] toBytes() {
        return toString().getBytes(options.encoding());
    }

    @Override
    public String toString() {
        return XmlBifPrinter.print(root, options.encoding(), options.prettyPrint());
    }
}
