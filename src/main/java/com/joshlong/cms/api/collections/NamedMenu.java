package com.joshlong.cms.api.collections;

import java.util.List;

public record NamedMenu(String name, List<MenuEntry> entries) {
}
