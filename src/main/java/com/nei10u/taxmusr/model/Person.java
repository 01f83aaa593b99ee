package com.nei10u.taxmusr.model;

/**
 * 单个纳税人的输入（采样后不可变）。
 *
 * @param income             应税收入
 * @param churchMember       是否缴纳教会税
 * @param wageReplacement    免税的工资替代收入（仅影响税率，Progressionsvorbehalt）
 * @param medicalCosts       自付医疗费用，超过收入相关阈值的部分可扣除
 * @param fullyLiableForTax  是否在德国负有无限纳税义务
 */
public record Person(double income,
                     boolean churchMember,
                     double wageReplacement,
                     double medicalCosts,
                     boolean fullyLiableForTax) {

    public static Person withIncome(double income) {
        return new Person(income, false, 0.0, 0.0, true);
    }

    public Person withChurchMember(boolean member) {
        return new Person(income, member, wageReplacement, medicalCosts, fullyLiableForTax);
    }

    public Person withWageReplacement(double amount) {
        return new Person(income, churchMember, amount, medicalCosts, fullyLiableForTax);
    }

    public Person withMedicalCosts(double amount) {
        return new Person(income, churchMember, wageReplacement, amount, fullyLiableForTax);
    }

    public Person withFullyLiableForTax(boolean liable) {
        return new Person(income, churchMember, wageReplacement, medicalCosts, liable);
    }
}
