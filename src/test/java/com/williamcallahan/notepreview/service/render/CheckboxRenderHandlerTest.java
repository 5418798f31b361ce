package com.williamcallahan.notepreview.service.render;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.UiCheckbox;
import com.williamcallahan.notepreview.domain.preview.UiGenericElement;
import com.williamcallahan.notepreview.service.workspace.ContentUpdater;
import com.williamcallahan.notepreview.service.workspace.PreviewBindings;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CheckboxRenderHandlerTest {

    @Test
    void toggleWritesFlippedMarkerBack() {
        AtomicReference<String> content = new AtomicReference<>("- [ ] a\n- [ ] b\n");
        ContentUpdater updater = update -> content.updateAndGet(update);
        PreviewBindings headless = PreviewBindings.headless();
        PreviewBindings bindings = new PreviewBindings(headless.attachments(), headless.workspace(),
            headless.navigator(), headless.notifications(), headless.browser(), updater);
        NodeRenderContext context = NodeRenderDispatcher.standard().newPass(RenderConfiguration.defaults(), bindings);
        CheckboxRenderHandler handler = new CheckboxRenderHandler();
        Element input = Jsoup.parseBodyFragment("<input type=\"checkbox\" disabled>").selectFirst("input");

        handler.render(input, context).join();
        UiCheckbox second = assertInstanceOf(UiCheckbox.class, handler.render(input, context).join());
        second.toggle();

        assertEquals(1, second.index());
        assertEquals("- [ ] a\n- [x] b\n", content.get());
    }

    @Test
    void otherInputsStayGeneric() {
        NodeRenderContext context = NodeRenderDispatcher.standard()
            .newPass(RenderConfiguration.defaults(), PreviewBindings.headless());
        Element input = Jsoup.parseBodyFragment("<input type=\"text\">").selectFirst("input");

        assertInstanceOf(UiGenericElement.class, new CheckboxRenderHandler().render(input, context).join());
        assertEquals(0, context.nextCheckboxIndex(), "Non-checkbox inputs must not take an index");
    }
}
