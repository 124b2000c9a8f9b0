package org.pragmatica.slides.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariablesTest {

    @Test
    void substitute_leavesUnknownNames() {
        var text = Variables.substitute("%{pagenumber} of %{totalpages} %{nope}",
                                        Map.of(Variables.PAGE_NUMBER, "2", Variables.TOTAL_PAGES, "9"));

        assertEquals("2 of 9 %{nope}", text);
    }

    @Test
    void substitute_appliesKeysInSortedOrder() {
        var variables = Map.of("%{a}", "see %{b}", "%{b}", "done", "%{c}", "%{a}");

        assertEquals("see done", Variables.substitute("%{a}", variables));
        assertEquals("%{a}", Variables.substitute("%{c}", variables));
    }

    @Test
    void bracket_wrapsName() {
        assertEquals("%{speaker}", Variables.bracket("speaker"));
    }
}
