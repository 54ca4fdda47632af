package com.ledgerlens.pipeline.classifier;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.TransactionType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Chilean expense and income categories (names are the stored category keys), plus the per-document-type
 * category bonus and the Spanish fallback descriptions.
 */
@Component
public class CategoryCatalogue {

    public static final String DEFAULT_EXPENSE_CATEGORY = "otros_gastos";
    public static final String DEFAULT_INCOME_CATEGORY = "otros_ingresos";

    private static final List<CategoryDefinition> EXPENSE = List.of(
            category("transporte", TransactionType.EXPENSE,
                    words("metro", "micro", "bus", "taxi", "uber", "cabify", "didi", "beat", "bencina", "gasolina",
                            "diesel", "parafina", "peaje", "estacionamiento", "transantiago", "red", "scoot", "lime",
                            "costanera norte", "autopista central", "tag"),
                    patterns("METRO.*", "TRANSANTIAGO.*", "COPEC.*", "SHELL.*", "PETROBRAS.*", "ENEX.*", "UBER.*",
                            "CABIFY.*", "DIDI.*", "BEAT.*", "AUTOPISTA.*", "COSTANERA NORTE.*"),
                    List.of(
                            sub("combustible", "bencina", "gasolina", "diesel", "copec", "shell", "petrobras", "enex"),
                            sub("transporte_publico", "metro", "micro", "bus", "transantiago", "red", "tren central"),
                            sub("taxi_rideshare", "taxi", "uber", "cabify", "didi", "beat"),
                            sub("peajes_estacionamiento", "estacionamiento", "parking", "peaje", "tag",
                                    "costanera norte", "autopista central"))),
            category("servicios_basicos", TransactionType.EXPENSE,
                    words("luz", "agua", "gas", "internet", "telefono", "cable", "enel", "cge", "chilectra",
                            "aguas andinas", "esval", "essbio", "metrogas", "lipigas", "abascal", "movistar", "entel",
                            "claro", "wom", "vtr", "directv", "gastos comunes"),
                    patterns("ENEL.*", "CGE.*", "CHILECTRA.*", "AGUAS ANDINAS.*", "ESVAL.*", "ESSBIO.*", "METROGAS.*",
                            "LIPIGAS.*", "MOVISTAR.*", "ENTEL.*", "CLARO.*", "WOM.*", "VTR.*", "DIRECTV.*",
                            "GASTOS COMUNES.*"),
                    List.of(
                            sub("electricidad", "luz", "electricidad", "enel", "cge", "chilectra"),
                            sub("agua", "agua", "aguas andinas", "esval", "essbio"),
                            sub("gas", "gas", "metrogas", "lipigas", "abascal"),
                            sub("internet_telefono", "internet", "telefono", "movistar", "entel", "claro", "wom", "vtr",
                                    "directv"),
                            sub("gastos_comunes", "gastos comunes", "gasto comun"))),
            category("alimentacion", TransactionType.EXPENSE,
                    words("supermercado", "restaurante", "comida", "almuerzo", "desayuno", "cena", "jumbo", "lider",
                            "santa isabel", "tottus", "unimarc", "acuenta", "mcdonalds", "burger king", "subway",
                            "pedidosya", "rappi", "uber eats", "starbucks", "dunkin", "juan valdez"),
                    patterns("JUMBO.*", "LIDER.*", "SANTA ISABEL.*", "TOTTUS.*", "UNIMARC.*", "ACUENTA.*",
                            "MCDONALDS.*", "BURGER KING.*", "SUBWAY.*", "PEDIDOSYA.*", "RAPPI.*", "UBER EATS.*",
                            "STARBUCKS.*", "DUNKIN.*"),
                    List.of(
                            sub("supermercado", "jumbo", "lider", "santa isabel", "tottus", "unimarc", "acuenta",
                                    "supermercado"),
                            sub("restaurantes", "restaurante", "comida", "almuerzo", "cena", "fuente de soda"),
                            sub("comida_rapida", "mcdonalds", "burger king", "subway", "dominos", "papa johns", "kfc",
                                    "wendys", "doggis"),
                            sub("delivery", "pedidos ya", "uber eats", "rappi", "delivery", "justo", "cornershop"),
                            sub("cafe_snacks", "starbucks", "dunkin", "juan valdez", "cafeteria", "helado",
                                    "emporio la rosa"))),
            category("compras", TransactionType.EXPENSE,
                    words("compra", "tienda", "retail", "mercado libre", "falabella", "ripley", "paris", "la polar",
                            "hites", "corona", "sodimac", "easy", "dafiti", "linio", "amazon", "aliexpress", "shein",
                            "zara", "h&m", "nike", "adidas", "pc factory"),
                    patterns("MERCADO LIBRE.*", "FALABELLA.*", "RIPLEY.*", "PARIS.*", "LA POLAR.*", "HITES.*",
                            "CORONA.*", "SODIMAC.*", "EASY.*", "DAFITI.*", "LINIO.*", "AMAZON.*", "ALIEXPRESS.*",
                            "SHEIN.*", "PCFACTORY.*"),
                    List.of(
                            sub("tienda_departamento", "falabella", "ripley", "paris", "la polar", "hites", "corona",
                                    "johnson"),
                            sub("electronica", "electronica", "computador", "celular", "telefono", "tv", "tablet",
                                    "sd card", "tarjeta sd", "pc factory", "wei", "spdigital", "maconline",
                                    "reiftstore", "pcfactory"),
                            sub("ropa_accesorios", "ropa", "zapatos", "accesorios", "vestuario", "zara", "h&m", "nike",
                                    "adidas", "dafiti", "shein", "feria"),
                            sub("hogar_mejoramiento", "muebles", "decoracion", "electrodomesticos", "casa", "sodimac",
                                    "easy", "ikea", "construmart", "imperial"),
                            sub("libros_hobbies", "libros", "libreria", "antartica", "lapiz lopez", "hobbies",
                                    "juguetes", "microplay", "weplay"),
                            sub("compras_online", "mercado libre", "linio", "amazon", "aliexpress", "wish", "ebay",
                                    "buscalibre"))),
            category("salud", TransactionType.EXPENSE,
                    words("medico", "doctor", "clinica", "hospital", "farmacia", "medicina", "consulta", "examenes",
                            "salud colmena", "isapre", "fonasa", "cruz verde", "salcobrand", "ahumada"),
                    patterns("CLINICA.*", "HOSPITAL.*", "FARMACIA.*", "SALUD COLMENA.*", "ISAPRE.*", "CRUZ VERDE.*",
                            "SALCOBRAND.*", "AHUMADA.*"),
                    List.of(
                            sub("consultas_medicas", "medico", "doctor", "consulta", "especialista", "integramedica"),
                            sub("medicamentos", "farmacia", "medicina", "medicamento", "salcobrand", "cruz verde",
                                    "farmacias ahumada"),
                            sub("examenes", "examenes", "laboratorio", "rayos x", "ecografia"),
                            sub("seguros_salud", "isapre", "fonasa", "seguro", "colmena", "consalud", "cruzblanca",
                                    "banmedica"))),
            category("educacion", TransactionType.EXPENSE,
                    words("colegio", "universidad", "instituto", "curso", "capacitacion", "libros", "matricula",
                            "mensualidad", "arancel", "preuniversitario"),
                    patterns("UNIVERSIDAD.*", "INSTITUTO.*", "COLEGIO.*", "PREUNIVERSITARIO.*"),
                    List.of(
                            sub("matriculas_aranceles", "matricula", "arancel", "colegiatura"),
                            sub("materiales_educativos", "libros", "cuadernos", "materiales", "fotocopias",
                                    "libreria antartica"),
                            sub("cursos_capacitacion", "curso", "capacitacion", "seminario", "taller", "udemy",
                                    "coursera"))),
            category("entretenimiento", TransactionType.EXPENSE,
                    words("cine", "teatro", "concierto", "netflix", "spotify", "amazon prime", "disney", "hbo",
                            "youtube premium", "juegos", "entretenimiento", "fiesta", "bar", "pub"),
                    patterns("NETFLIX.*", "SPOTIFY.*", "AMAZON PRIME.*", "DISNEY.*", "CINE.*", "CINEMARK.*",
                            "CINEHOYTS.*", "YOUTUBE.*"),
                    List.of(
                            sub("streaming", "netflix", "spotify", "amazon prime", "disney", "hbo", "youtube premium",
                                    "crunchyroll"),
                            sub("cine_eventos", "cine", "teatro", "concierto", "espectaculo", "cinemark", "cinehoyts",
                                    "puntoticket"),
                            sub("deportes_gym", "gimnasio", "gym", "deporte", "futbol", "tenis", "smartfit",
                                    "pacific fitness"),
                            sub("salidas", "bar", "pub", "discoteca", "fiesta")))
    );

    private static final List<CategoryDefinition> INCOME = List.of(
            category("sueldo", TransactionType.INCOME,
                    words("sueldo", "salario", "remuneracion", "liquidacion", "haberes", "empresa"),
                    patterns("SUELDO.*", "REMUNERACION.*", "LIQUIDACION.*"), List.of()),
            category("trabajo_independiente", TransactionType.INCOME,
                    words("honorarios", "freelance", "independiente", "servicios", "consultoria", "boleta"),
                    patterns("HONORARIOS.*", "SERVICIOS.*", "CONSULTORIA.*"), List.of()),
            category("negocio", TransactionType.INCOME,
                    words("ventas", "negocio", "comercio", "empresa", "factura", "ingreso"),
                    patterns("VENTAS.*", "FACTURA.*", "COMERCIO.*"), List.of()),
            category("inversiones", TransactionType.INCOME,
                    words("dividendos", "intereses", "inversion", "renta", "deposito plazo", "acciones"),
                    patterns("DIVIDENDOS.*", "INTERESES.*", "RENTA.*"), List.of()),
            category("otros_ingresos", TransactionType.INCOME,
                    words("regalo", "bono", "subsidio", "devolucion", "reembolso", "premio"),
                    patterns("BONO.*", "SUBSIDIO.*", "DEVOLUCION.*"), List.of())
    );

    private static final Map<DocumentType, Set<String>> DOCUMENT_TYPE_BONUS = Map.of(
            DocumentType.RECEIPT, Set.of("alimentacion", "transporte", "servicios_basicos"),
            DocumentType.INVOICE, Set.of("servicios_basicos", "salud", "educacion"),
            DocumentType.PAYSLIP, Set.of("sueldo"),
            DocumentType.BANK_STATEMENT, Set.of("inversiones", "sueldo")
    );

    private static final Map<String, String> FALLBACK_DESCRIPTIONS = Map.of(
            "transporte", "Gasto en transporte",
            "servicios_basicos", "Pago de servicios básicos",
            "alimentacion", "Gasto en alimentación",
            "salud", "Gasto médico o de salud",
            "educacion", "Gasto en educación",
            "entretenimiento", "Gasto en entretenimiento",
            "sueldo", "Ingreso por sueldo",
            "trabajo_independiente", "Ingreso por trabajo independiente",
            "negocio", "Ingreso por negocio",
            "inversiones", "Ingreso por inversiones"
    );

    public List<CategoryDefinition> categoriesFor(TransactionType type) {
        return type == TransactionType.INCOME ? INCOME : EXPENSE;
    }

    public String defaultCategory(TransactionType type) {
        return type == TransactionType.INCOME ? DEFAULT_INCOME_CATEGORY : DEFAULT_EXPENSE_CATEGORY;
    }

    public boolean hasDocumentTypeBonus(DocumentType documentType, String category) {
        if (documentType == null) {
            return false;
        }
        return DOCUMENT_TYPE_BONUS.getOrDefault(documentType, Set.of()).contains(category);
    }

    public String fallbackDescription(String category) {
        return FALLBACK_DESCRIPTIONS.getOrDefault(category, "Transacción financiera");
    }

    private static CategoryDefinition category(String name, TransactionType type, List<String> keywords,
                                               List<Pattern> patterns, List<CategoryDefinition.Subcategory> subs) {
        return new CategoryDefinition(name, type, keywords, patterns, subs);
    }

    private static List<String> words(String... keywords) {
        return List.of(keywords);
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    private static CategoryDefinition.Subcategory sub(String name, String... keywords) {
        return new CategoryDefinition.Subcategory(name, List.of(keywords));
    }
}
