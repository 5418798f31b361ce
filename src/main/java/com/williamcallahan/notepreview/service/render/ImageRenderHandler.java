package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.AttachmentMetadata;
import com.williamcallahan.notepreview.domain.preview.UiAttachmentImage;
import com.williamcallahan.notepreview.domain.preview.UiElement;
import com.williamcallahan.notepreview.domain.preview.UiExpandableImage;
import org.jsoup.nodes.Element;

import java.util.concurrent.CompletableFuture;

/**
 * Renders {@code img}: a bare attachment name becomes an attachment image, anything else an
 * expandable image loaded from its URL.
 */
public class ImageRenderHandler implements NodeRenderHandler {

    @Override
    public CompletableFuture<UiElement> render(Element element, NodeRenderContext context) {
        String src = element.attr("src");
        String alt = element.attr("alt");
        String title = element.hasAttr("title") ? element.attr("title") : null;
        if (!src.isEmpty() && !src.contains("/")) {
            AttachmentMetadata attachment = context.bindings().attachments().get(src);
            if (attachment != null) {
                return CompletableFuture.completedFuture(new UiAttachmentImage(attachment, alt, title));
            }
        }
        return CompletableFuture.completedFuture(new UiExpandableImage(src, alt, title));
    }
}
