package com.placement.service;

import com.placement.exception.OfferValidationException;
import com.placement.model.Offer;
import com.placement.model.RolePackage;
import com.placement.model.Student;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Structural checks run before an offer touches the store.
 */
@Component
public class OfferValidator {

    /**
     * @throws OfferValidationException describing the first problem found
     */
    public void validate(Offer offer) {
        if (offer == null) {
            throw new OfferValidationException("Offer is null");
        }
        if (isBlank(offer.company())) {
            throw new OfferValidationException("Offer has no company");
        }
        for (RolePackage role : offer.roles()) {
            if (role == null) {
                throw new OfferValidationException("Offer for '" + offer.company() + "' contains a null role");
            }
            requireNonNegative(role.packageValue(), offer.company(), "role '" + role.role() + "'");
        }
        int index = 0;
        for (Student student : offer.studentsSelected()) {
            if (student == null) {
                throw new OfferValidationException(
                        "Offer for '" + offer.company() + "' has a null student at position " + index);
            }
            if (isBlank(student.enrollmentNumber())) {
                throw new OfferValidationException(
                        "Student at position " + index + " of offer for '" + offer.company()
                                + "' has no enrollment number");
            }
            requireNonNegative(student.packageValue(), offer.company(),
                    "student " + student.enrollmentNumber());
            index++;
        }
    }

    private void requireNonNegative(BigDecimal value, String company, String what) {
        if (value != null && value.signum() < 0) {
            throw new OfferValidationException(
                    "Negative package " + value + " for " + what + " in offer for '" + company + "'");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
