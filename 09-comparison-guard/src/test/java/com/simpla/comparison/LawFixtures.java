package com.simpla.comparison;

import com.simpla.comparison.model.Article;
import com.simpla.comparison.model.Chapter;
import com.simpla.comparison.model.Inciso;
import com.simpla.comparison.model.Law;
import com.simpla.comparison.model.Title;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A trimmed-down Ley de Contrato de Trabajo and helpers to build operations by hand.
 */
public final class LawFixtures {

    private LawFixtures() {}

    public static Law contractLaw() {
        Law law = new Law("20744", "Ley de Contrato de Trabajo");

        Title general = new Title("I", "Disposiciones generales");
        general.getArticles().add(new Article("1", "Fuentes de regulación", "El contrato de trabajo se rige por esta ley."));
        Article scope = new Article("2", "Ámbito de aplicación", "La vigencia de esta ley no será aplicable:");
        scope.getIncisos().add(new Inciso("a", "A los dependientes de la Administración Pública."));
        scope.getIncisos().add(new Inciso("b", "A los trabajadores de casas particulares."));
        general.getArticles().add(scope);
        general.getArticles().add(new Article("3", "Ley aplicable", "Esta ley regirá todo lo relativo a la validez."));
        law.getTitles().add(general);

        Title contract = new Title("II", "Del contrato de trabajo en general");
        Chapter definition = new Chapter("I", "Del contrato y la relación de trabajo");
        definition.getArticles().add(new Article("21", "Contrato de trabajo", "Habrá contrato de trabajo..."));
        definition.getArticles().add(new Article("22", "Relación de trabajo", "Habrá relación de trabajo..."));
        definition.getArticles().add(new Article("29", "Interposición", "Los trabajadores que habiendo sido contratados..."));
        contract.getChapters().add(definition);
        Chapter subjects = new Chapter("II", "De los sujetos del contrato");
        subjects.getArticles().add(new Article("30", "Subcontratación", "Quienes cedan total o parcialmente..."));
        subjects.getArticles().add(new Article("40", "Trabajo prohibido", "Se considerará prohibido el objeto..."));
        contract.getChapters().add(subjects);
        law.getTitles().add(contract);

        Title duties = new Title("III", "De los derechos y obligaciones de las partes");
        Chapter powers = new Chapter("VII", "De las facultades del empleador");
        powers.getArticles().add(new Article("62", "Obligación genérica", "Las partes están obligadas..."));
        powers.getArticles().add(new Article("63", "Buena fe", "Las partes están obligadas a obrar de buena fe..."));
        duties.getChapters().add(powers);
        duties.getChapters().add(new Chapter("VIII", "De la formación profesional"));
        duties.getChapters().add(new Chapter("IX", "De los derechos de invención"));
        law.getTitles().add(duties);

        Title termination = new Title("IV", "De la extinción del contrato");
        Article severance = new Article("245", "Indemnización por antigüedad", "En los casos de despido:");
        severance.getIncisos().add(new Inciso("a", "Un mes de sueldo por año de servicio."));
        severance.getIncisos().add(new Inciso("b", "La mejor remuneración mensual."));
        severance.getIncisos().add(new Inciso("c", "El tope previsto en el convenio."));
        termination.getArticles().add(severance);
        termination.getArticles().add(new Article("246", "Despido indirecto", "Cuando el trabajador hiciere denuncia..."));
        law.getTitles().add(termination);

        return law;
    }

    public static Operation operation(String id, Action action, Target target, String replacementText) {
        Operation operation = Operation.open(id, "ARTÍCULO " + id + "- " + action.getVerb() + " ...", action, "I");
        List<String> lines = replacementText == null
                ? Collections.emptyList()
                : replacementText.lines().collect(Collectors.toList());
        operation.seal(lines);
        operation.setTarget(target);
        operation.setLawNumber("20744");
        return operation;
    }

    public static Operation operation(String id, Action action, Target target) {
        return operation(id, action, target, null);
    }
}
