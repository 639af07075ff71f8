package com.casespace.app.inventory;

import java.util.Locale;

import com.casespace.app.database.JsonColumns;
import com.casespace.app.inventory.TreeWalker.WalkedFile;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Monta o registro de {@code file_metadata.inventory_data} de cada entrada inserida ou atualizada.
 * Só campos do filesystem; metadata de documento é extraída em outro lugar.
 */
final class InventoryData {

    private InventoryData() {}

    static String of(WalkedFile f) {
        ObjectNode node = JsonColumns.mapper().createObjectNode();
        node.put("file_name", f.name());
        node.put("file_size", f.size());
        node.put("file_extension", f.fileType().toLowerCase(Locale.ROOT));
        node.put("created_at", f.createdMillis());
        node.put("modified_at", f.modifiedMillis());

        String folder = f.folderPath();
        String[] segments = folder.isEmpty() ? new String[0] : folder.split("/");
        node.put("parent_folder", segments.length == 0 ? "" : segments[segments.length - 1]);
        node.put("folder_depth", segments.length);
        ArrayNode arr = node.putArray("file_path_segments");
        for (String s : segments) arr.add(s);

        return JsonColumns.write(node);
    }
}
