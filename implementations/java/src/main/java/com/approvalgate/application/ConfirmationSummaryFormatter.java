package com.approvalgate.application;

import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.InputField;
import com.approvalgate.domain.model.MutationAction;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders the markdown shown to the approver: what the entity is and exactly
 * what will change.
 */
@Component
public class ConfirmationSummaryFormatter {

    public String format(MutationAction action, EntitySnapshot entity, Map<String, String> suppliedFields) {
        EntityType type = action.getEntityType();
        StringBuilder message = new StringBuilder();

        message.append(action.getHeading()).append("\n\n");
        message.append("**").append(type.getTitle()).append(" ID:** ").append(entity.getId()).append('\n');

        for (EntityType.SummaryField field : type.getSummaryFields()) {
            Object value = entity.get(field.getColumn());
            String rendered = value == null
                ? "N/A"
                : field.isMoney() ? EntityType.formatMoney(value) : value.toString();
            message.append("**").append(field.getLabel()).append(":** ").append(rendered).append('\n');
        }

        for (InputField field : action.getUserSuppliedFields()) {
            String value = suppliedFields.get(field.getName());
            if (value != null) {
                message.append("**").append(field.getLabel()).append(":** ").append(value).append('\n');
            }
        }

        message.append('\n');
        if (action.isDeletion()) {
            message.append("This action will permanently delete this ").append(type.getLabel())
                .append(" and cannot be undone.");
        } else {
            message.append("This will change the ").append(type.getLabel()).append(" status from ")
                .append(entity.getStatus()).append(" to ").append(action.getTransition().getToStatus())
                .append('.');
        }
        return message.toString();
    }
}
