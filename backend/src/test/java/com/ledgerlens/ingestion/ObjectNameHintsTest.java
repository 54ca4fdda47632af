package com.ledgerlens.ingestion;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ObjectNameHintsTest {

    @Test
    @DisplayName("only upload events on supported document files count")
    void documentUploads() {
        assertThat(ObjectNameHints.isDocumentUpload("com.oraclecloud.objectstorage.createobject", "a/b.PDF")).isTrue();
        assertThat(ObjectNameHints.isDocumentUpload("ObjectCreated:Put", "scan.jpeg")).isTrue();
        assertThat(ObjectNameHints.isDocumentUpload("com.oraclecloud.objectstorage.deleteobject", "a.pdf")).isFalse();
        assertThat(ObjectNameHints.isDocumentUpload("ObjectCreated", "notes.txt")).isFalse();
        assertThat(ObjectNameHints.isDocumentUpload(null, "a.pdf")).isFalse();
    }

    @Test
    @DisplayName("user id, source and document type are read from the object name")
    void hintsFromName() {
        String name = "whatsapp/user123_boleta_jumbo.jpg";

        assertThat(ObjectNameHints.userId(name)).isEqualTo("user123");
        assertThat(ObjectNameHints.source(name)).isEqualTo(UploadSource.WHATSAPP);
        assertThat(ObjectNameHints.documentType(name)).isEqualTo(DocumentType.RECEIPT);

        assertThat(ObjectNameHints.userId("uploads/scan.pdf")).isEqualTo(ObjectNameHints.UNKNOWN_USER);
        assertThat(ObjectNameHints.source("web/user7/factura.pdf")).isEqualTo(UploadSource.WEB);
        assertThat(ObjectNameHints.documentType("web/user7/factura.pdf")).isEqualTo(DocumentType.INVOICE);
        assertThat(ObjectNameHints.documentType("estado_cuenta_mayo.pdf")).isEqualTo(DocumentType.BANK_STATEMENT);
        assertThat(ObjectNameHints.documentType("liquidacion.pdf")).isEqualTo(DocumentType.OTHERS);
        assertThat(ObjectNameHints.source(null)).isEqualTo(UploadSource.API);
    }

    @Test
    @DisplayName("region comes from the event source host, with a default")
    void region() {
        assertThat(ObjectNameHints.region("https://objectstorage.sa-santiago-1.oraclecloud.com/n/ns"))
                .isEqualTo("sa-santiago-1");
        assertThat(ObjectNameHints.region("local")).isEqualTo(ObjectNameHints.DEFAULT_REGION);
        assertThat(ObjectNameHints.region(null)).isEqualTo(ObjectNameHints.DEFAULT_REGION);
    }
}
